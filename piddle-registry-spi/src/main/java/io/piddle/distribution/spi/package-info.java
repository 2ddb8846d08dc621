/**
 * Registry-side SPI: manifest schema dispatch and the manifest storage contract.
 *
 * <p>The SPI is blocking and minimal, intended to be adapted by HTTP and storage collaborators
 * using their preferred execution model.
 */
package io.piddle.distribution.spi;
