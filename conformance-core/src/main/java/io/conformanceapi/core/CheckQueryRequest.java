package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Request for {@code GET /checkQuery}: one field per primitive kind, each bound from the query parameter of the
 * same name. The {@code datetime} field is the ISO-8601 text exactly as sent.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record CheckQueryRequest(
        @JsonProperty("string") Optional<String> stringValue,
        @JsonProperty("boolean") Optional<Boolean> booleanValue,
        @JsonProperty("double") Optional<Double> doubleValue,
        @JsonProperty("int32") Optional<Integer> int32,
        @JsonProperty("int64") Optional<Long> int64,
        @JsonProperty("decimal") Optional<BigDecimal> decimal,
        @JsonProperty("enum") Optional<Answer> enumValue,
        @JsonProperty("datetime") Optional<String> datetime
) {
    public CheckQueryRequest {
        stringValue = Objects.requireNonNullElse(stringValue, Optional.empty());
        booleanValue = Objects.requireNonNullElse(booleanValue, Optional.empty());
        doubleValue = Objects.requireNonNullElse(doubleValue, Optional.empty());
        int32 = Objects.requireNonNullElse(int32, Optional.empty());
        int64 = Objects.requireNonNullElse(int64, Optional.empty());
        decimal = Objects.requireNonNullElse(decimal, Optional.empty());
        enumValue = Objects.requireNonNullElse(enumValue, Optional.empty());
        datetime = Objects.requireNonNullElse(datetime, Optional.empty());
    }
}
