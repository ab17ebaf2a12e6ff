package io.conformanceapi.conformance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conformanceapi.conformance.ConformanceServerConfiguration.ServiceKind;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConformanceServerTest {

    private static final ObjectMapper MAPPER = JacksonJsonCodec.newObjectMapper();

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private ConformanceServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    @Test
    void referenceServiceRoundTrip() throws Exception {
        start(ServiceKind.REFERENCE);

        HttpResponse<String> created = send(HttpRequest.newBuilder(uri("/widgets"))
                .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"one\",\"price\":2.5}"))
                .header("Content-Type", "application/json"));
        assertThat(created.statusCode()).isEqualTo(201);
        assertThat(created.headers().firstValue("Location")).contains("/widgets/1");
        assertThat(created.headers().firstValue("Content-Type")).hasValueSatisfying(ct -> assertThat(ct).startsWith("application/json"));
        String eTag = created.headers().firstValue("eTag").orElseThrow();

        HttpResponse<String> fetched = send(HttpRequest.newBuilder(uri("/widgets/1")).GET());
        assertThat(fetched.statusCode()).isEqualTo(200);
        assertThat(fetched.headers().firstValue("eTag")).contains(eTag);
        assertThat(json(fetched).get("name").asText()).isEqualTo("one");

        HttpResponse<String> notModified = send(HttpRequest.newBuilder(uri("/widgets/1"))
                .header("If-None-Match", eTag)
                .GET());
        assertThat(notModified.statusCode()).isEqualTo(304);
        assertThat(notModified.body()).isEmpty();

        HttpResponse<String> conflict = send(HttpRequest.newBuilder(uri("/widgets/1"))
                .header("If-Match", "\"other\"")
                .DELETE());
        assertThat(conflict.statusCode()).isEqualTo(409);

        HttpResponse<String> deleted = send(HttpRequest.newBuilder(uri("/widgets/1"))
                .header("If-Match", eTag)
                .DELETE());
        assertThat(deleted.statusCode()).isEqualTo(204);

        HttpResponse<String> gone = send(HttpRequest.newBuilder(uri("/widgets/1")).DELETE());
        assertThat(gone.statusCode()).isEqualTo(404);
    }

    @Test
    void referenceServiceBindsQueryAndPath() throws Exception {
        start(ServiceKind.REFERENCE);

        HttpResponse<String> query = send(HttpRequest.newBuilder(
                uri("/checkQuery?string=x%20y&int32=12.7&int64=5px&boolean=nope")).GET());
        assertThat(query.statusCode()).isEqualTo(200);
        assertThat(json(query)).isEqualTo(MAPPER.readTree("{\"string\":\"x y\",\"int32\":12,\"int64\":5}"));

        HttpResponse<String> path = send(HttpRequest.newBuilder(
                uri("/checkPath/a%20b/TRUE/1.5/1/2/3.0/no/2001-02-03T04:05:06Z")).GET());
        assertThat(path.statusCode()).isEqualTo(200);
        JsonNode body = json(path);
        assertThat(body.get("string").asText()).isEqualTo("a b");
        assertThat(body.get("boolean").asBoolean()).isTrue();
        assertThat(body.get("enum").asText()).isEqualTo("no");
    }

    @Test
    void unencodedQueryCharactersAreBoundNotRejected() throws Exception {
        start(ServiceKind.REFERENCE);

        String response;
        try (Socket socket = new Socket("localhost", server.port())) {
            socket.setSoTimeout(10_000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET /checkQuery?string=a|b^{c}&int32=5 HTTP/1.1\r\n"
                    + "Host: localhost\r\n"
                    + "Connection: close\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
            out.flush();
            response = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        }

        assertThat(response).startsWith("HTTP/1.1 200");
        assertThat(response).contains("\"string\":\"a|b^{c}\"").contains("\"int32\":5");
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        start(ServiceKind.REFERENCE);

        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/nowhere")).GET());

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).get("code").asText()).isEqualTo("NotFound");
    }

    @Test
    void fixtureServiceAnswersFromBundledCases() throws Exception {
        start(ServiceKind.FIXTURES);

        HttpResponse<String> info = send(HttpRequest.newBuilder(uri("/")).GET());
        assertThat(info.statusCode()).isEqualTo(200);
        assertThat(json(info)).isEqualTo(MAPPER.readTree("{\"service\":\"ConformanceApi\",\"version\":\"0.1.0\"}"));

        HttpResponse<String> batch = send(HttpRequest.newBuilder(uri("/widgets/get"))
                .POST(HttpRequest.BodyPublishers.ofString("[1,3,999]")));
        assertThat(batch.statusCode()).isEqualTo(200);
        assertThat(json(batch)).hasSize(3);
        assertThat(json(batch).get(2).get("error").get("code").asText()).isEqualTo("NotFound");

        HttpResponse<String> created = send(HttpRequest.newBuilder(uri("/widgets"))
                .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"four\",\"price\":4}")));
        assertThat(created.statusCode()).isEqualTo(201);
        assertThat(created.headers().firstValue("Location")).contains("/widgets/4");
        assertThat(created.headers().firstValue("eTag")).contains("\"f00d:4\"");

        HttpResponse<String> unmatched = send(HttpRequest.newBuilder(uri("/checkQuery?int32=77")).GET());
        assertThat(unmatched.statusCode()).isEqualTo(400);
        assertThat(json(unmatched).get("code").asText()).isEqualTo("InvalidRequest");
    }

    private void start(ServiceKind service) throws Exception {
        ConformanceServerConfiguration config = new ConformanceServerConfiguration(0, Optional.empty(), service, 100);
        server = ConformanceServer.create(config).start(0);
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://localhost:" + server.port() + pathAndQuery);
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
        return client.send(request.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }
}
