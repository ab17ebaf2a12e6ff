package io.conformanceapi.server.core;

import io.conformanceapi.core.Answer;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Converts raw query-string and path-segment text into typed primitives.
 *
 * <p>Every function is total: malformed input yields {@link Optional#empty()}, never an exception, so a
 * field that fails to coerce is simply left unset. {@code null} and empty input are absent for every kind.
 * Boolean and numeric kinds ignore surrounding whitespace; text, enum and datetime values are kept verbatim.
 *
 * <ul>
 *   <li>boolean: {@code true}/{@code false}, case-insensitive</li>
 *   <li>int32/int64: the leading base-10 integer is taken and any fractional or trailing text is dropped
 *       ({@code "12.7"} is 12); out-of-range values are absent</li>
 *   <li>double: {@link Double#parseDouble}, so {@code NaN} and {@code Infinity} parse</li>
 *   <li>decimal: {@link BigDecimal#BigDecimal(String)}</li>
 *   <li>enum: the raw tag, unvalidated</li>
 *   <li>datetime: the raw text, unparsed</li>
 * </ul>
 */
public final class PrimitiveCoercion {
    private PrimitiveCoercion() {}

    public static Optional<String> toText(String raw) {
        return isAbsent(raw) ? Optional.empty() : Optional.of(raw);
    }

    public static Optional<Boolean> toBoolean(String raw) {
        if (isAbsent(raw)) return Optional.empty();
        String s = raw.trim();
        if ("true".equalsIgnoreCase(s)) return Optional.of(Boolean.TRUE);
        if ("false".equalsIgnoreCase(s)) return Optional.of(Boolean.FALSE);
        return Optional.empty();
    }

    public static Optional<Integer> toInt32(String raw) {
        return leadingInteger(raw)
                .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    public static Optional<Long> toInt64(String raw) {
        return leadingInteger(raw);
    }

    public static Optional<Double> toDouble(String raw) {
        if (isAbsent(raw)) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<BigDecimal> toDecimal(String raw) {
        if (isAbsent(raw)) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<Answer> toAnswer(String raw) {
        return isAbsent(raw) ? Optional.empty() : Optional.of(Answer.of(raw));
    }

    public static Optional<String> toDateTime(String raw) {
        return toText(raw);
    }

    private static Optional<Long> leadingInteger(String raw) {
        if (isAbsent(raw)) return Optional.empty();
        String s = raw.trim();
        int i = 0;
        if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
        int digitsStart = i;
        while (i < s.length() && s.charAt(i) >= '0' && s.charAt(i) <= '9') i++;
        if (i == digitsStart) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(s.substring(0, i)));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }

    private static boolean isAbsent(String raw) {
        return raw == null || raw.isEmpty();
    }
}
