package io.conformanceapi.server.core.routing;

import io.conformanceapi.server.core.HttpMethod;

import java.util.Objects;

/**
 * A single entry of the route table.
 *
 * @param method the HTTP method
 * @param path the path template
 * @param operation the API operation name, used for logging
 * @param endpoint the bind, call, shape pipeline
 */
public record Route(HttpMethod method, PathTemplate path, String operation, Endpoint endpoint) {
    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(endpoint, "endpoint");
    }
}
