package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetsResponse(Optional<List<Widget>> widgets) {

    public GetWidgetsResponse {
        widgets = Objects.requireNonNullElse(widgets, Optional.empty());
    }

    public static GetWidgetsResponse of(List<Widget> widgets) {
        return new GetWidgetsResponse(Optional.of(List.copyOf(widgets)));
    }
}
