package io.conformanceapi.conformance;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One recorded exchange from a conformance fixture file.
 *
 * @param test the case name ({@code name} is accepted as an alias)
 * @param method the API method, e.g. {@code getWidget}
 * @param request the typed request as JSON; {@code null} means an empty request
 * @param response the typed response value as JSON, used when {@code error} is absent
 * @param error the service error as JSON, if the case expects a failure
 */
public record ConformanceCase(
        @JsonAlias("name") String test,
        String method,
        JsonNode request,
        JsonNode response,
        JsonNode error
) {
    public boolean expectsError() {
        return error != null && !error.isNull();
    }
}
