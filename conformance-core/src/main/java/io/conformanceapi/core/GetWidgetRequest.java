package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code GET /widgets/:id}.
 *
 * @param id widget id from the path; empty when the segment is not an integer
 * @param ifNotETag value of {@code If-None-Match}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetRequest(Optional<Integer> id, @JsonProperty("ifNotETag") Optional<String> ifNotETag) {

    public GetWidgetRequest {
        id = Objects.requireNonNullElse(id, Optional.empty());
        ifNotETag = Objects.requireNonNullElse(ifNotETag, Optional.empty());
    }
}
