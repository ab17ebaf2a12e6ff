package io.conformanceapi.conformance;

import com.fasterxml.jackson.databind.JsonNode;
import io.conformanceapi.core.Protocol;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.server.core.ConformanceApiHandler;
import io.conformanceapi.server.core.HttpMethod;
import io.conformanceapi.server.core.ResponseBody;
import io.conformanceapi.server.core.ServerRequest;
import io.conformanceapi.server.core.ServerResponse;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayInputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Sends every bundled case over its HTTP binding and checks that the fixture service finds exactly that case.
 */
class BundledCasesReplayTest {

    private static final JacksonJsonCodec CODEC = new JacksonJsonCodec();
    private static final List<String> PATH_FIELDS = List.of(Protocol.F_STRING, Protocol.F_BOOLEAN, Protocol.F_DOUBLE,
            Protocol.F_INT32, Protocol.F_INT64, Protocol.F_DECIMAL, Protocol.F_ENUM, Protocol.F_DATETIME);

    static List<ConformanceCase> bundledCases() throws Exception {
        return ConformanceCases.fromClasspath(CODEC, ConformanceCases.DEFAULT_RESOURCE);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("bundledCases")
    void everyBundledCaseIsReachable(ConformanceCase c) throws Exception {
        ConformanceApiHandler handler = ConformanceApiHandler
                .builder(new FixtureConformanceApi(bundledCases(), CODEC))
                .build();

        ServerResponse response = handler.handle(toHttp(c)).join();

        if (c.expectsError()) {
            assertThat(bodyOf(response)).as(c.test()).isEqualTo(c.error());
        } else {
            assertThat(response.status()).as(c.test() + " answered " + bodyText(response)).isLessThan(400);
        }
    }

    private static ServerRequest toHttp(ConformanceCase c) throws Exception {
        JsonNode req = c.request();
        Map<String, List<String>> headers = new LinkedHashMap<>();
        switch (c.method()) {
            case "getApiInfo":
                return request(HttpMethod.GET, "/", null, headers, null);
            case "getWidgets":
                return request(HttpMethod.GET, "/widgets",
                        req.has("query") ? Protocol.Q_QUERY + "=" + encode(req.get("query").asText()) : null, headers, null);
            case "createWidget":
                return request(HttpMethod.POST, "/widgets", null, headers, req.get("widget"));
            case "getWidget":
                if (req.has("ifNotETag")) headers.put(Protocol.H_IF_NONE_MATCH, List.of(req.get("ifNotETag").asText()));
                return request(HttpMethod.GET, "/widgets/" + idOf(req), null, headers, null);
            case "deleteWidget":
                if (req.has("ifETag")) headers.put(Protocol.H_IF_MATCH, List.of(req.get("ifETag").asText()));
                return request(HttpMethod.DELETE, "/widgets/" + idOf(req), null, headers, null);
            case "getWidgetBatch":
                return request(HttpMethod.POST, "/widgets/get", null, headers, req.get("ids"));
            case "mirrorFields":
                return request(HttpMethod.POST, "/mirrorFields", null, headers, req.size() == 0 ? null : req);
            case "checkQuery":
                List<String> params = new ArrayList<>();
                req.fields().forEachRemaining(e -> params.add(e.getKey() + "=" + encode(e.getValue().asText())));
                return request(HttpMethod.GET, "/checkQuery", params.isEmpty() ? null : String.join("&", params), headers, null);
            case "checkPath":
                StringBuilder path = new StringBuilder("/checkPath");
                for (String field : PATH_FIELDS) {
                    path.append('/').append(encode(req.get(field).asText()));
                }
                return request(HttpMethod.GET, path.toString(), null, headers, null);
            default:
                throw new IllegalArgumentException("no HTTP binding for " + c.method());
        }
    }

    private static ServerRequest request(HttpMethod method, String path, String query,
                                         Map<String, List<String>> headers, JsonNode body) throws Exception {
        return new ServerRequest(method, ServerRequest.target(path, query), headers,
                body == null ? null : new ByteArrayInputStream(CODEC.writeBytes(body)));
    }

    private static String idOf(JsonNode req) {
        return req.has("id") ? req.get("id").asText() : "none";
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static JsonNode bodyOf(ServerResponse response) throws Exception {
        return CODEC.getMapper().readTree(bodyText(response));
    }

    private static String bodyText(ServerResponse response) {
        return response.body() instanceof ResponseBody.Bytes bytes
                ? new String(bytes.bytes(), StandardCharsets.UTF_8)
                : "";
    }
}
