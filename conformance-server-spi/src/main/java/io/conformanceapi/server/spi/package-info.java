/**
 * Server-side SPI for the conformance API.
 *
 * <p>{@link io.conformanceapi.server.spi.ConformanceApi} is the capability the HTTP layer calls, one method
 * per endpoint. Blocking implementations ({@link io.conformanceapi.server.spi.BlockingConformanceApi}) are
 * adapted with {@link io.conformanceapi.server.spi.BlockingToAsyncAdapter}.
 */
package io.conformanceapi.server.spi;
