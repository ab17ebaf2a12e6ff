package io.conformanceapi.server.core.routing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A path template such as {@code /widgets/:id}. Segments starting with {@code :} capture one URL-decoded path
 * segment under that name; all other segments must match literally.
 */
public final class PathTemplate {
    private final String template;
    private final List<String> segments;

    private PathTemplate(String template, List<String> segments) {
        this.template = template;
        this.segments = segments;
    }

    public static PathTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        if (!template.startsWith("/")) throw new IllegalArgumentException("template must start with '/': " + template);
        List<String> segments = split(template);
        List<String> names = new ArrayList<>();
        for (String s : segments) {
            if (!s.startsWith(":")) continue;
            String name = s.substring(1);
            if (name.isEmpty()) throw new IllegalArgumentException("empty parameter name in " + template);
            if (names.contains(name)) throw new IllegalArgumentException("duplicate parameter '" + name + "' in " + template);
            names.add(name);
        }
        return new PathTemplate(template, List.copyOf(segments));
    }

    /**
     * Matches a raw (still percent-encoded) request path.
     *
     * @return the captured parameters, decoded, or empty if the path does not match
     */
    public Optional<Map<String, String>> match(String rawPath) {
        List<String> actual = split(rawPath == null || rawPath.isEmpty() ? "/" : rawPath);
        if (actual.size() != segments.size()) return Optional.empty();

        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String expected = segments.get(i);
            String segment = actual.get(i);
            if (expected.startsWith(":")) {
                if (segment.isEmpty()) return Optional.empty();
                params.put(expected.substring(1), decode(segment));
            } else if (!expected.equals(decode(segment))) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(params));
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }

    private static List<String> split(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        int start = 0;
        while (true) {
            int slash = trimmed.indexOf('/', start);
            if (slash < 0) {
                out.add(trimmed.substring(start));
                return out;
            }
            out.add(trimmed.substring(start, slash));
            start = slash + 1;
        }
    }

    private static String decode(String segment) {
        // '+' is literal in a path segment
        String s = segment.replace("+", "%2B");
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformedEscape) {
            return segment;
        }
    }
}
