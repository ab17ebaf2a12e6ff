package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code POST /widgets}; the widget is the JSON body taken verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record CreateWidgetRequest(Optional<Widget> widget) {

    public CreateWidgetRequest {
        widget = Objects.requireNonNullElse(widget, Optional.empty());
    }
}
