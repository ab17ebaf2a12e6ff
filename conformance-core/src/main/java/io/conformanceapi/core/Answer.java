package io.conformanceapi.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.Set;

/**
 * The {@code enum} primitive of the conformance API.
 *
 * <p>Modelled as an open value type rather than a Java enum: the HTTP layer forwards whatever tag the
 * client sent, and only the API service decides whether it is one of the known answers.
 */
public final class Answer {
    public static final Answer YES = new Answer("yes");
    public static final Answer NO = new Answer("no");
    public static final Answer MAYBE = new Answer("maybe");

    private static final Set<Answer> KNOWN = Set.of(YES, NO, MAYBE);

    private final String tag;

    private Answer(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    @JsonCreator
    public static Answer of(String tag) {
        return new Answer(tag);
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /** Whether the tag is one of {@code yes}, {@code no}, {@code maybe}. */
    public boolean isKnown() {
        return KNOWN.contains(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Answer)) return false;
        return tag.equals(((Answer) other).tag);
    }

    @Override
    public int hashCode() {
        return tag.hashCode();
    }

    @Override
    public String toString() {
        return tag;
    }
}
