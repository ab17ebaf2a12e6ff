package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Response for {@code POST /widgets/get}.
 *
 * @param results one result per requested id, in request order
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetBatchResponse(Optional<List<ServiceResult<Widget>>> results) {

    public GetWidgetBatchResponse {
        results = Objects.requireNonNullElse(results, Optional.empty());
    }

    public static GetWidgetBatchResponse of(List<ServiceResult<Widget>> results) {
        return new GetWidgetBatchResponse(Optional.of(List.copyOf(results)));
    }
}
