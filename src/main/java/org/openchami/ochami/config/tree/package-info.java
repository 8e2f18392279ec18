/**
 * Schema-agnostic configuration trees with deep merge and dotted-key access.
 *
 * @since 0.1.0
 */
package org.openchami.ochami.config.tree;
