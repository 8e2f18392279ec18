package org.openchami.ochami.config;

/**
 * Failure categories raised by configuration loading, merging, mutation, and endpoint resolution.
 *
 * @since 0.1.0
 */
public enum ConfigErrorKind {
  /** Requested configuration file does not exist. Skipped silently while cascading. */
  SOURCE_NOT_FOUND,
  /** File content is not well-formed YAML or has an unsupported document shape. */
  PARSE_ERROR,
  /** Tree contains a key the typed schema does not define. */
  UNKNOWN_KEY,
  /** Value has the wrong type or an unusable form for its key. */
  INVALID_VALUE,
  /** Key is not valid for the requested operation. */
  INVALID_KEY,
  /** The same key holds structurally different values in two merged trees. */
  MERGE_TYPE_MISMATCH,
  /** Two cluster entries share one name. */
  DUPLICATE_CLUSTER_NAME,
  /** Named cluster does not exist. */
  CLUSTER_NOT_FOUND,
  /** Cluster base URI is not of the form {@code scheme://host[:port][/path]}. */
  INVALID_CLUSTER_URI,
  /** Service URI is neither an absolute URI nor a usable relative path. */
  INVALID_SERVICE_URI,
  /** Neither the cluster URI nor the service URI is set. */
  MISSING_URI,
  /** Service name is not one the client knows about. */
  UNKNOWN_SERVICE,
  /** Rename target collides with an existing cluster. */
  CANNOT_RENAME_TO_EXISTING,
  /** Attempt to delete the {@code name} key of a cluster. */
  CANNOT_UNSET_NAME
}
