package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Response for {@code GET /widgets/:id}.
 *
 * <p>Either {@code widget} is present (fresh resource, 200) or {@code notModified} is true (304, no body).
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetWidgetResponse(Optional<Widget> widget, @JsonProperty("eTag") Optional<String> eTag, Optional<Boolean> notModified) {

    public GetWidgetResponse {
        widget = Objects.requireNonNullElse(widget, Optional.empty());
        eTag = Objects.requireNonNullElse(eTag, Optional.empty());
        notModified = Objects.requireNonNullElse(notModified, Optional.empty());
    }

    public static GetWidgetResponse fresh(Widget widget, String eTag) {
        return new GetWidgetResponse(Optional.of(widget), Optional.ofNullable(eTag), Optional.empty());
    }

    public static GetWidgetResponse notModified(String eTag) {
        return new GetWidgetResponse(Optional.empty(), Optional.ofNullable(eTag), Optional.of(true));
    }
}
