package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Response for {@code POST /widgets}.
 *
 * @param widget the stored widget, sent as the 201 body
 * @param url location of the new resource, sent as the {@code Location} header
 * @param eTag version token of the new resource, sent as the {@code eTag} header
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record CreateWidgetResponse(Optional<Widget> widget, Optional<String> url, @JsonProperty("eTag") Optional<String> eTag) {

    public CreateWidgetResponse {
        widget = Objects.requireNonNullElse(widget, Optional.empty());
        url = Objects.requireNonNullElse(url, Optional.empty());
        eTag = Objects.requireNonNullElse(eTag, Optional.empty());
    }
}
