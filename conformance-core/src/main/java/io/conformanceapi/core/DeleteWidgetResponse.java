package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

/**
 * Response for {@code DELETE /widgets/:id}. Both flags absent means the widget was deleted.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record DeleteWidgetResponse(Optional<Boolean> notFound, Optional<Boolean> conflict) {

    public DeleteWidgetResponse {
        notFound = Objects.requireNonNullElse(notFound, Optional.empty());
        conflict = Objects.requireNonNullElse(conflict, Optional.empty());
    }

    public static DeleteWidgetResponse deleted() {
        return new DeleteWidgetResponse(Optional.empty(), Optional.empty());
    }

    public static DeleteWidgetResponse notFoundResponse() {
        return new DeleteWidgetResponse(Optional.of(true), Optional.empty());
    }

    public static DeleteWidgetResponse conflictResponse() {
        return new DeleteWidgetResponse(Optional.empty(), Optional.of(true));
    }
}
