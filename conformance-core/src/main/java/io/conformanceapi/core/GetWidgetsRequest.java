package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code GET /widgets}.
 *
 * @param query optional free-text filter, bound from the {@code q} query parameter
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetsRequest(Optional<String> query) {

    public GetWidgetsRequest {
        query = Objects.requireNonNullElse(query, Optional.empty());
    }
}
