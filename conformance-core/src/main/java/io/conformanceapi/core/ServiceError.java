package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * An error returned by the API service.
 *
 * @param code symbolic error code, see {@link ErrorCodes}; unknown or missing codes map to HTTP 500
 * @param message optional human-readable message
 * @param details optional free-form details, passed through verbatim
 * @param innerError optional nested error
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record ServiceError(
        Optional<String> code,
        Optional<String> message,
        Optional<JsonNode> details,
        Optional<ServiceError> innerError
) {
    public ServiceError {
        code = Objects.requireNonNullElse(code, Optional.empty());
        message = Objects.requireNonNullElse(message, Optional.empty());
        details = JsonNodes.present(details);
        innerError = Objects.requireNonNullElse(innerError, Optional.empty());
    }

    public static ServiceError of(String code) {
        return new ServiceError(Optional.ofNullable(code), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static ServiceError of(String code, String message) {
        return new ServiceError(Optional.ofNullable(code), Optional.ofNullable(message), Optional.empty(), Optional.empty());
    }
}
