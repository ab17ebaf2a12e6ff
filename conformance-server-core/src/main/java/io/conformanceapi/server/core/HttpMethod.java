package io.conformanceapi.server.core;

import java.util.Locale;
import java.util.Optional;

public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS,
    TRACE,
    CONNECT;

    /**
     * Parses a method name case-insensitively; unknown names yield empty.
     */
    public static Optional<HttpMethod> parse(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
