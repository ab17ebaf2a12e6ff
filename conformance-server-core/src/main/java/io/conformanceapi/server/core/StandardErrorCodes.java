package io.conformanceapi.server.core;

import io.conformanceapi.core.ErrorCodes;

import java.util.Map;
import java.util.Optional;

/**
 * The fixed mapping from symbolic error codes to HTTP status codes, shared by every endpoint.
 */
public final class StandardErrorCodes {
    private StandardErrorCodes() {}

    /** Status for unknown or missing codes. */
    public static final int DEFAULT_STATUS = 500;

    private static final Map<String, Integer> STATUS_BY_CODE = Map.ofEntries(
            Map.entry(ErrorCodes.NOT_MODIFIED, 304),
            Map.entry(ErrorCodes.INVALID_REQUEST, 400),
            Map.entry(ErrorCodes.NOT_AUTHENTICATED, 401),
            Map.entry(ErrorCodes.NOT_AUTHORIZED, 403),
            Map.entry(ErrorCodes.NOT_FOUND, 404),
            Map.entry(ErrorCodes.CONFLICT, 409),
            Map.entry(ErrorCodes.REQUEST_TOO_LARGE, 413),
            Map.entry(ErrorCodes.TOO_MANY_REQUESTS, 429),
            Map.entry(ErrorCodes.INTERNAL_ERROR, 500),
            Map.entry(ErrorCodes.SERVICE_UNAVAILABLE, 503),
            Map.entry(ErrorCodes.NOT_ADMIN, 403)
    );

    public static int statusFor(String code) {
        if (code == null) return DEFAULT_STATUS;
        return STATUS_BY_CODE.getOrDefault(code, DEFAULT_STATUS);
    }

    public static int statusFor(Optional<String> code) {
        return statusFor(code.orElse(null));
    }

    /** The full table, unmodifiable. */
    public static Map<String, Integer> asMap() {
        return STATUS_BY_CODE;
    }
}
