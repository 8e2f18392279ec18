/**
 * <strong>Purpose:</strong> Validation helpers used while materializing configuration values.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.openchami.ochami.validation;
