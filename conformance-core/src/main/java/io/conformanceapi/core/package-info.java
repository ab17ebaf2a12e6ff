/**
 * Protocol-centric core for the conformance API.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and header helpers</li>
 *   <li>The typed request and response models, one pair per endpoint</li>
 *   <li>The value-or-error {@link io.conformanceapi.core.ServiceResult} union and {@link io.conformanceapi.core.ServiceError}</li>
 * </ul>
 *
 * <p>Every optional field is modelled as an {@link java.util.Optional}; an empty optional means the field was
 * absent on the wire and is omitted when serialized. HTTP bindings live in other modules.
 */
package io.conformanceapi.core;
