/**
 * Schema-neutral manifest model.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Content identity: {@link io.piddle.distribution.core.Digest} and
 *       {@link io.piddle.distribution.core.Descriptor}</li>
 *   <li>The {@link io.piddle.distribution.core.Manifest} and
 *       {@link io.piddle.distribution.core.ManifestBuilder} contracts every schema implements</li>
 *   <li>Content-Type parsing, the request context and the exception hierarchy</li>
 * </ul>
 *
 * <p>Schema dispatch and storage contracts live in the registry SPI module.
 */
package io.piddle.distribution.core;
