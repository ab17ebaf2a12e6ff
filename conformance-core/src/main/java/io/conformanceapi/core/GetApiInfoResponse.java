package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record GetApiInfoResponse(Optional<String> service, Optional<String> version) {

    public GetApiInfoResponse {
        service = Objects.requireNonNullElse(service, Optional.empty());
        version = Objects.requireNonNullElse(version, Optional.empty());
    }

    public static GetApiInfoResponse of(String service, String version) {
        return new GetApiInfoResponse(Optional.ofNullable(service), Optional.ofNullable(version));
    }
}
