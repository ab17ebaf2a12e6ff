package io.conformanceapi.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #firstValue} but treats an empty header value as absent.
     */
    public static Optional<String> firstNonEmptyValue(Map<String, ? extends Iterable<String>> headers, String name) {
        return firstValue(headers, name).filter(v -> !v.isEmpty());
    }
}
