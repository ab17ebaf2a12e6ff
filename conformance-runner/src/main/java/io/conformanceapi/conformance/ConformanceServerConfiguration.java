package io.conformanceapi.conformance;

import io.conformanceapi.server.spi.ReferenceConformanceApi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Runner settings, read from {@code conformance-server.properties} on the classpath and overridden by system
 * properties of the same name.
 *
 * <ul>
 *   <li>{@code conformance.port}: listen port, {@code 0} for an ephemeral one. Default {@value #DEFAULT_PORT}.</li>
 *   <li>{@code conformance.fixtures}: fixture file path. Default: the bundled {@code ConformanceTests.json}.</li>
 *   <li>{@code conformance.service}: {@code fixtures} or {@code reference}. Default {@code fixtures}.</li>
 *   <li>{@code conformance.max-batch-size}: batch limit of the reference service.</li>
 * </ul>
 */
public record ConformanceServerConfiguration(
        int port,
        Optional<String> fixtures,
        ServiceKind service,
        int maxBatchSize
) {
    public static final String RESOURCE = "conformance-server.properties";

    public static final String P_PORT = "conformance.port";
    public static final String P_FIXTURES = "conformance.fixtures";
    public static final String P_SERVICE = "conformance.service";
    public static final String P_MAX_BATCH_SIZE = "conformance.max-batch-size";

    public static final int DEFAULT_PORT = 4117;

    /** Which {@link io.conformanceapi.server.spi.ConformanceApi} the runner serves. */
    public enum ServiceKind {
        FIXTURES,
        REFERENCE;

        static ServiceKind parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown " + P_SERVICE + ": " + value, e);
            }
        }
    }

    public ConformanceServerConfiguration {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("invalid " + P_PORT + ": " + port);
        if (maxBatchSize <= 0) throw new IllegalArgumentException("invalid " + P_MAX_BATCH_SIZE + ": " + maxBatchSize);
        fixtures = Objects.requireNonNullElse(fixtures, Optional.empty());
        Objects.requireNonNull(service, P_SERVICE);
    }

    public static ConformanceServerConfiguration defaults() {
        return new ConformanceServerConfiguration(
                DEFAULT_PORT, Optional.empty(), ServiceKind.FIXTURES, ReferenceConformanceApi.DEFAULT_MAX_BATCH_SIZE);
    }

    /** Classpath resource overlaid with {@link System#getProperties()}. */
    public static ConformanceServerConfiguration load() {
        Properties merged = new Properties();
        try (InputStream in = ConformanceServerConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) merged.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        merged.putAll(System.getProperties());
        return from(merged);
    }

    public static ConformanceServerConfiguration from(Properties props) {
        ConformanceServerConfiguration d = defaults();
        return new ConformanceServerConfiguration(
                intProperty(props, P_PORT, d.port()),
                Optional.ofNullable(props.getProperty(P_FIXTURES)).map(String::trim).filter(s -> !s.isEmpty()),
                Optional.ofNullable(props.getProperty(P_SERVICE)).map(ServiceKind::parse).orElse(d.service()),
                intProperty(props, P_MAX_BATCH_SIZE, d.maxBatchSize()));
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + raw, e);
        }
    }
}
