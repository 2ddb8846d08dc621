/**
 * Registry-side implementations of the SPI: ServiceLoader schema discovery and the
 * reference in-memory manifest service.
 */
package io.piddle.distribution.registry;
