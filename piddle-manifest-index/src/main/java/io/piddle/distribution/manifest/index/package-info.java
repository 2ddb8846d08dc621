/**
 * The piddle image index manifest schema, encoded with Jackson.
 *
 * <p>Registered through {@code META-INF/services} so that
 * {@code ServiceLoaderSchemaRegistry} picks it up when this module is on the class path.
 */
package io.piddle.distribution.manifest.index;
