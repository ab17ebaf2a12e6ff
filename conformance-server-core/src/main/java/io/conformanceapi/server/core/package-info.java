/**
 * Framework-neutral server core for the conformance API.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.conformanceapi.server.core.ConformanceApiHandler} (router and dispatcher)</li>
 *   <li>{@link io.conformanceapi.server.core.PrimitiveCoercion} and {@link io.conformanceapi.server.core.StandardErrorCodes}</li>
 *   <li>The per-endpoint request binder and response shaper in {@code handlers}</li>
 *   <li>The static route table in {@code routing}</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.conformanceapi.server.core.ServerRequest} and
 * {@link io.conformanceapi.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.conformanceapi.server.core;
