package io.conformanceapi.server.core.handlers;

import io.conformanceapi.core.Answer;
import io.conformanceapi.core.CheckPathRequest;
import io.conformanceapi.core.CheckQueryRequest;
import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.GetWidgetBatchRequest;
import io.conformanceapi.core.GetWidgetRequest;
import io.conformanceapi.core.MirrorFieldsRequest;
import io.conformanceapi.core.Widget;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.server.core.HttpMethod;
import io.conformanceapi.server.core.ServerRequest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestBinderTest {

    private final RequestBinder binder = new RequestBinder(new JacksonJsonCodec());

    @Test
    void checkQueryCoercesEachPresentParameter() {
        CheckQueryRequest request = binder.checkQuery(context(
                "/checkQuery?string=x%20y&boolean=TRUE&double=0.5&int32=12.7&int64=5px&decimal=1.50&enum=nope&datetime=2001-02-03T04:05:06Z",
                Map.of(), Map.of(), null));

        assertThat(request.stringValue()).contains("x y");
        assertThat(request.booleanValue()).contains(true);
        assertThat(request.doubleValue()).contains(0.5);
        assertThat(request.int32()).contains(12);
        assertThat(request.int64()).contains(5L);
        assertThat(request.decimal()).contains(new BigDecimal("1.50"));
        assertThat(request.enumValue()).contains(Answer.of("nope"));
        assertThat(request.datetime()).contains("2001-02-03T04:05:06Z");
    }

    @Test
    void checkQueryLeavesMissingOrMalformedParametersUnset() {
        CheckQueryRequest request = binder.checkQuery(context(
                "/checkQuery?boolean=maybe&int32=abc&double=&string=a&string=b", Map.of(), Map.of(), null));

        assertThat(request.booleanValue()).isEmpty();
        assertThat(request.int32()).isEmpty();
        assertThat(request.doubleValue()).isEmpty();
        assertThat(request.stringValue()).isEmpty();
        assertThat(request.datetime()).isEmpty();
    }

    @Test
    void checkPathBindsSegments() {
        CheckPathRequest request = binder.checkPath(context("/checkPath/ignored",
                Map.of("string", "a b", "boolean", "false", "double", "x", "int32", "-4",
                        "int64", "99", "decimal", "2", "enum", "yes", "datetime", "now"),
                Map.of(), null));

        assertThat(request.stringValue()).contains("a b");
        assertThat(request.booleanValue()).contains(false);
        assertThat(request.doubleValue()).isEmpty();
        assertThat(request.int32()).contains(-4);
        assertThat(request.int64()).contains(99L);
        assertThat(request.enumValue()).contains(Answer.YES);
    }

    @Test
    void getWidgetBindsIdAndIfNoneMatch() {
        GetWidgetRequest request = binder.getWidget(context("/widgets/7",
                Map.of("id", "7"), Map.of("if-none-match", List.of("\"a:1\"")), null));

        assertThat(request.id()).contains(7);
        assertThat(request.ifNotETag()).contains("\"a:1\"");

        GetWidgetRequest unbound = binder.getWidget(context("/widgets/x",
                Map.of("id", "x"), Map.of("If-None-Match", List.of("")), null));
        assertThat(unbound.id()).isEmpty();
        assertThat(unbound.ifNotETag()).isEmpty();
    }

    @Test
    void bodiesAreTakenVerbatim() {
        CreateWidgetRequest create = binder.createWidget(context("/widgets", Map.of(), Map.of(),
                "{\"name\":\"w\",\"price\":1.25,\"color\":\"red\"}"));
        assertThat(create.widget()).contains(Widget.of("w", new BigDecimal("1.25")));

        GetWidgetBatchRequest batch = binder.getWidgetBatch(context("/widgets/get", Map.of(), Map.of(), "[1,3,999]"));
        assertThat(batch.ids()).contains(List.of(1, 3, 999));

        MirrorFieldsRequest mirror = binder.mirrorFields(context("/mirrorFields", Map.of(), Map.of(),
                "{\"field\":{\"a\":[1]},\"matrix\":[[[1.5]]]}"));
        assertThat(mirror.field()).hasValueSatisfying(f -> assertThat(f.get("a").get(0).asInt()).isEqualTo(1));
        assertThat(mirror.matrix()).contains(List.of(List.of(List.of(1.5))));
    }

    @Test
    void malformedOrEmptyBodiesLeaveThePayloadUnset() {
        assertThat(binder.createWidget(context("/widgets", Map.of(), Map.of(), "{not json")).widget()).isEmpty();
        assertThat(binder.createWidget(context("/widgets", Map.of(), Map.of(), null)).widget()).isEmpty();
        assertThat(binder.getWidgetBatch(context("/widgets/get", Map.of(), Map.of(), "[\"a\"]")).ids()).isEmpty();
        assertThat(binder.getWidgetBatch(context("/widgets/get", Map.of(), Map.of(), "")).ids()).isEmpty();

        MirrorFieldsRequest mirror = binder.mirrorFields(context("/mirrorFields", Map.of(), Map.of(), "[]"));
        assertThat(mirror.field()).isEmpty();
        assertThat(mirror.matrix()).isEmpty();
    }

    private static BindingContext context(String pathAndQuery, Map<String, String> pathParams,
                                          Map<String, List<String>> headers, String body) {
        ServerRequest request = new ServerRequest(
                HttpMethod.GET,
                URI.create("http://localhost" + pathAndQuery),
                new LinkedHashMap<>(headers),
                body == null ? null : new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        return new BindingContext(request, pathParams);
    }
}
