package io.conformanceapi.server.core.handlers;

import io.conformanceapi.core.Headers;
import io.conformanceapi.server.core.QueryString;
import io.conformanceapi.server.core.ServerRequest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The raw inputs of one routed request: query parameters, path parameters, headers and body.
 */
public final class BindingContext {
    private final ServerRequest request;
    private final Map<String, String> pathParams;
    private final Map<String, List<String>> query;

    public BindingContext(ServerRequest request, Map<String, String> pathParams) {
        this.request = Objects.requireNonNull(request, "request");
        this.pathParams = Objects.requireNonNull(pathParams, "pathParams");
        this.query = QueryString.parse(request.uri());
    }

    /** A query parameter sent exactly once with a non-empty value. */
    public Optional<String> query(String name) {
        return QueryString.single(query, name);
    }

    /** A decoded path segment captured by the route template. */
    public Optional<String> path(String name) {
        return Optional.ofNullable(pathParams.get(name));
    }

    /** The first value of a header, case-insensitive; empty values read as absent. */
    public Optional<String> header(String name) {
        return Headers.firstNonEmptyValue(request.headers(), name);
    }

    /** The whole request body, or empty when there is none. */
    public Optional<byte[]> body() {
        InputStream in = request.body();
        if (in == null) return Optional.empty();
        try (in) {
            byte[] bytes = in.readAllBytes();
            return bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read request body", e);
        }
    }
}
