package io.conformanceapi.server.core.routing;

import io.conformanceapi.server.core.ServerResponse;
import io.conformanceapi.server.core.handlers.BindingContext;

import java.util.concurrent.CompletableFuture;

/**
 * One endpoint's pipeline: bind the request, call the API service, shape the result.
 */
@FunctionalInterface
public interface Endpoint {
    CompletableFuture<ServerResponse> dispatch(BindingContext context);
}
