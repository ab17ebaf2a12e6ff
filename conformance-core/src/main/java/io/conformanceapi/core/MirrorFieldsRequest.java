package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code POST /mirrorFields}.
 *
 * @param field arbitrary JSON value
 * @param matrix three-dimensional array of doubles
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record MirrorFieldsRequest(Optional<JsonNode> field, Optional<List<List<List<Double>>>> matrix) {

    public MirrorFieldsRequest {
        field = JsonNodes.present(field);
        matrix = Objects.requireNonNullElse(matrix, Optional.empty());
    }
}
