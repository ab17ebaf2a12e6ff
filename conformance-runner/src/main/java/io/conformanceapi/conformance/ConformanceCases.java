package io.conformanceapi.conformance;

import com.fasterxml.jackson.databind.JsonNode;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.json.jackson.JsonException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads conformance fixtures of the form {@code {"tests": [ ... ]}}.
 */
public final class ConformanceCases {
    private ConformanceCases() {}

    /** Fixture file bundled with the runner. */
    public static final String DEFAULT_RESOURCE = "ConformanceTests.json";

    public static List<ConformanceCase> fromPath(JacksonJsonCodec codec, Path path) throws IOException, JsonException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(codec, in);
        }
    }

    public static List<ConformanceCase> fromClasspath(JacksonJsonCodec codec, String resource)
            throws IOException, JsonException {
        try (InputStream in = ConformanceCases.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("fixture resource not found: " + resource);
            return read(codec, in);
        }
    }

    public static List<ConformanceCase> read(JacksonJsonCodec codec, InputStream in) throws JsonException {
        JsonNode root = codec.readTree(in);
        JsonNode tests = root == null ? null : root.get("tests");
        if (tests == null || !tests.isArray()) throw new JsonException("fixture document has no \"tests\" array");

        List<ConformanceCase> cases = new ArrayList<>(tests.size());
        for (JsonNode test : tests) {
            ConformanceCase c = codec.treeToValue(test, ConformanceCase.class);
            if (c.method() == null) throw new JsonException("fixture case without method: " + c.test());
            cases.add(c);
        }
        return List.copyOf(cases);
    }
}
