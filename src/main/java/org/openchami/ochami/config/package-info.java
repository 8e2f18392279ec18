/**
 * Layered ochami configuration: file loading, cascading, strict typing, and single-file edits.
 * <p><strong>Role:</strong> Entry points are {@link org.openchami.ochami.config.CascadeResolver} for reads and
 * {@link org.openchami.ochami.config.ConfigMutator} for edits.</p>
 * <p><strong>Concurrency:</strong> Typed configuration records are immutable; safe to share.</p>
 * <p><strong>Errors:</strong> Failures surface as {@link org.openchami.ochami.config.ConfigException} carrying a
 * {@link org.openchami.ochami.config.ConfigErrorKind}; I/O failures propagate as {@link java.io.IOException}.</p>
 */
package org.openchami.ochami.config;
