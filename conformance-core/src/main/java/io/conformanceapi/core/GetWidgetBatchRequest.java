package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code POST /widgets/get}; the ids are the JSON array body.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetBatchRequest(Optional<List<Integer>> ids) {

    public GetWidgetBatchRequest {
        ids = Objects.requireNonNullElse(ids, Optional.empty());
    }
}
