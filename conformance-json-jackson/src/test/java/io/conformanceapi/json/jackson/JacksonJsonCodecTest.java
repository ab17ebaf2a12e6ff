package io.conformanceapi.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import io.conformanceapi.core.CheckQueryResponse;
import io.conformanceapi.core.ErrorCodes;
import io.conformanceapi.core.GetWidgetBatchResponse;
import io.conformanceapi.core.GetWidgetResponse;
import io.conformanceapi.core.MirrorFieldsRequest;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.core.ServiceResult;
import io.conformanceapi.core.Widget;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void absentFieldsAreOmitted() throws Exception {
        byte[] json = codec.writeBytes(GetWidgetResponse.notModified("\"a:1\""));

        assertThat(codec.getMapper().readTree(json))
                .isEqualTo(codec.getMapper().readTree("{\"eTag\":\"\\\"a:1\\\"\",\"notModified\":true}"));
    }

    @Test
    void writesBatchResultsAsValueOrError() throws Exception {
        GetWidgetBatchResponse response = GetWidgetBatchResponse.of(List.of(
                ServiceResult.value(Widget.of(1, "one", new BigDecimal("1.5"))),
                ServiceResult.failure(ErrorCodes.NOT_FOUND, "Widget not found.")));

        JsonNode tree = codec.writeTree(response);

        assertThat(tree.get("results")).hasSize(2);
        assertThat(tree.get("results").get(0).get("value").get("name").asText()).isEqualTo("one");
        assertThat(tree.get("results").get(1).has("value")).isFalse();
        assertThat(tree.get("results").get(1).get("error").get("code").asText()).isEqualTo("NotFound");
    }

    @Test
    void readsBatchResultsWithTypedValues() throws Exception {
        byte[] json = """
                {"results":[{"value":{"id":1,"name":"one","price":1.5}},{"error":{"code":"NotFound"}},{}]}
                """.getBytes(StandardCharsets.UTF_8);

        GetWidgetBatchResponse response = codec.readValue(json, GetWidgetBatchResponse.class);

        List<ServiceResult<Widget>> results = response.results().orElseThrow();
        assertThat(results).hasSize(3);
        assertThat(results.get(0)).isEqualTo(ServiceResult.value(Widget.of(1, "one", new BigDecimal("1.5"))));
        assertThat(results.get(1)).isEqualTo(ServiceResult.failure(ServiceError.of(ErrorCodes.NOT_FOUND)));
        assertThat(results.get(2)).isEqualTo(ServiceResult.value(null));
    }

    @Test
    void nullDetailsAndFieldsAreReadAsAbsent() throws Exception {
        ServiceError error = codec.readValue(
                "{\"code\":\"NotFound\",\"message\":\"gone\",\"details\":null}".getBytes(StandardCharsets.UTF_8),
                ServiceError.class);
        MirrorFieldsRequest request = codec.readValue(
                "{\"matrix\":[[[1.0]]]}".getBytes(StandardCharsets.UTF_8), MirrorFieldsRequest.class);

        assertThat(error.details()).isEmpty();
        assertThat(codec.writeTree(error).fieldNames()).toIterable().containsExactlyInAnyOrder("code", "message");
        assertThat(request.field()).isEmpty();
        assertThat(codec.writeTree(request).has("field")).isFalse();
    }

    @Test
    void primitiveFieldsUseTheirWireNames() throws Exception {
        byte[] json = "{\"string\":\"s\",\"boolean\":true,\"enum\":\"maybe\",\"unknown\":1}".getBytes(StandardCharsets.UTF_8);

        CheckQueryResponse response = codec.readValue(json, CheckQueryResponse.class);

        assertThat(response.stringValue()).contains("s");
        assertThat(response.booleanValue()).contains(true);
        assertThat(response.enumValue().map(a -> a.tag())).contains("maybe");
        assertThat(response.int32()).isEmpty();
        assertThat(codec.writeTree(response).fieldNames()).toIterable()
                .containsExactly("string", "boolean", "enum");
    }

    @Test
    void malformedInputIsReportedAsJsonException() {
        assertThatThrownBy(() -> codec.readList("[1,".getBytes(StandardCharsets.UTF_8), Integer.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("List<java.lang.Integer>");
    }
}
