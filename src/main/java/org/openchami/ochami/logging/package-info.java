/**
 * <strong>Purpose:</strong> Bridges resolved configuration to the SLF4J/Logback backend.
 * <p><strong>Concurrency:</strong> Stateless helpers meant for CLI bootstrap.
 *
 * @since 0.1.0
 */
package org.openchami.ochami.logging;
