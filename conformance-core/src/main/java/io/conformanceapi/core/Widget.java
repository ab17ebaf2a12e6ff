package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A widget. Owned by the API service; the HTTP layer passes it through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record Widget(Optional<Integer> id, Optional<String> name, Optional<BigDecimal> price) {

    public Widget {
        id = Objects.requireNonNullElse(id, Optional.empty());
        name = Objects.requireNonNullElse(name, Optional.empty());
        price = Objects.requireNonNullElse(price, Optional.empty());
    }

    public static Widget of(String name, BigDecimal price) {
        return new Widget(Optional.empty(), Optional.ofNullable(name), Optional.ofNullable(price));
    }

    public static Widget of(int id, String name, BigDecimal price) {
        return new Widget(Optional.of(id), Optional.ofNullable(name), Optional.ofNullable(price));
    }

    public Widget withId(int newId) {
        return new Widget(Optional.of(newId), name, price);
    }
}
