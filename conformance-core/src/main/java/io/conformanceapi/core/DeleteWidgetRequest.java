package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code DELETE /widgets/:id}.
 *
 * @param id widget id from the path; empty when the segment is not an integer
 * @param ifETag value of {@code If-Match}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record DeleteWidgetRequest(Optional<Integer> id, @JsonProperty("ifETag") Optional<String> ifETag) {

    public DeleteWidgetRequest {
        id = Objects.requireNonNullElse(id, Optional.empty());
        ifETag = Objects.requireNonNullElse(ifETag, Optional.empty());
    }
}
