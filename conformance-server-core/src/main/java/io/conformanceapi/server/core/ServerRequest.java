package io.conformanceapi.server.core;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Adapters should map their framework-specific request objects to this class.
 */
public final class ServerRequest {
    private static final String PATH_CHARS = "-_.!~*'();/:@&=+$,";
    private static final String QUERY_CHARS = PATH_CHARS + "?[]";

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // may be null

    /**
     * Creates a new request.
     *
     * @param method the HTTP method
     * @param uri the request URI; path and raw query are used for routing and binding
     * @param headers the request headers
     * @param body the request body stream (may be null if empty)
     */
    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
    }

    /**
     * Builds a request URI from the raw path and query a host received. Characters a URI cannot carry
     * (such as {@code |}, {@code ^}, braces and non-ASCII text) and stray {@code %} signs are percent-encoded;
     * existing escapes are kept as sent.
     *
     * @param rawPath the undecoded request path
     * @param rawQuery the undecoded query string, or null
     */
    public static URI target(String rawPath, String rawQuery) {
        Objects.requireNonNull(rawPath, "rawPath");
        String path = quote(rawPath, PATH_CHARS);
        return URI.create(rawQuery == null ? path : path + "?" + quote(rawQuery, QUERY_CHARS));
    }

    private static String quote(String raw, String allowed) {
        StringBuilder sb = new StringBuilder(raw.length());
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            if (b == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                sb.append('%');
            } else if (b < 0x80 && (Character.isLetterOrDigit(b) || allowed.indexOf(b) >= 0)) {
                sb.append((char) b);
            } else {
                sb.append('%').append(Character.toUpperCase(Character.forDigit(b >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
            }
        }
        return sb.toString();
    }

    private static boolean isHex(byte b) {
        return Character.digit(b, 16) >= 0;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }
}
