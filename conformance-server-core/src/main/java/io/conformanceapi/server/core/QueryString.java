package io.conformanceapi.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class QueryString {
    private QueryString() {}

    /**
     * Parses the raw query into decoded keys, each with its values in request order. A key without {@code =}
     * has a single empty value.
     */
    public static Map<String, List<String>> parse(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return Map.of();
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String k = decode(eq < 0 ? part : part.substring(0, eq));
            String v = eq < 0 ? "" : decode(part.substring(eq + 1));
            out.computeIfAbsent(k, key -> new ArrayList<>()).add(v);
        }
        return out;
    }

    /**
     * Returns the parameter's value when it occurs exactly once with a non-empty value. A repeated parameter
     * is not a single string and reads as absent.
     */
    public static Optional<String> single(Map<String, List<String>> query, String key) {
        List<String> values = query.get(key);
        if (values == null || values.size() != 1) return Optional.empty();
        String v = values.get(0);
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }

    static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformedEscape) {
            // kept verbatim; binding never rejects a request
            return s;
        }
    }
}
