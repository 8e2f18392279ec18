/**
 * Service base URI resolution for cluster profiles.
 */
package org.openchami.ochami.endpoint;
