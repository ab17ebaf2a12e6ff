package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record MirrorFieldsResponse(Optional<JsonNode> field, Optional<List<List<List<Double>>>> matrix) {

    public MirrorFieldsResponse {
        field = JsonNodes.present(field);
        matrix = Objects.requireNonNullElse(matrix, Optional.empty());
    }

    public static MirrorFieldsResponse echo(MirrorFieldsRequest request) {
        return new MirrorFieldsResponse(request.field(), request.matrix());
    }
}
