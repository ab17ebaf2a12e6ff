package io.conformanceapi.conformance;

import com.fasterxml.jackson.databind.JsonNode;
import io.conformanceapi.core.CheckPathRequest;
import io.conformanceapi.core.CheckPathResponse;
import io.conformanceapi.core.CheckQueryRequest;
import io.conformanceapi.core.CheckQueryResponse;
import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.CreateWidgetResponse;
import io.conformanceapi.core.DeleteWidgetRequest;
import io.conformanceapi.core.DeleteWidgetResponse;
import io.conformanceapi.core.ErrorCodes;
import io.conformanceapi.core.GetApiInfoRequest;
import io.conformanceapi.core.GetApiInfoResponse;
import io.conformanceapi.core.GetWidgetBatchRequest;
import io.conformanceapi.core.GetWidgetBatchResponse;
import io.conformanceapi.core.GetWidgetRequest;
import io.conformanceapi.core.GetWidgetResponse;
import io.conformanceapi.core.GetWidgetsRequest;
import io.conformanceapi.core.GetWidgetsResponse;
import io.conformanceapi.core.MirrorFieldsRequest;
import io.conformanceapi.core.MirrorFieldsResponse;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.core.ServiceResult;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.json.jackson.JsonException;
import io.conformanceapi.server.spi.ConformanceApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ConformanceApi} that answers from recorded fixture cases.
 *
 * <p>A call selects the cases recorded for the same API method whose request equals the typed request once
 * written as JSON, comparing numbers by value. Exactly one match answers with its error or response; anything
 * else is an {@code InvalidRequest} failure.
 */
public final class FixtureConformanceApi implements ConformanceApi {
    private static final Logger log = LoggerFactory.getLogger(FixtureConformanceApi.class);

    private static final Comparator<JsonNode> BY_VALUE = FixtureConformanceApi::compareScalars;

    private final List<ConformanceCase> cases;
    private final JacksonJsonCodec codec;

    public FixtureConformanceApi(List<ConformanceCase> cases) {
        this(cases, new JacksonJsonCodec());
    }

    public FixtureConformanceApi(List<ConformanceCase> cases, JacksonJsonCodec codec) {
        this.cases = List.copyOf(Objects.requireNonNull(cases, "cases"));
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletableFuture<ServiceResult<GetApiInfoResponse>> getApiInfo(GetApiInfoRequest request) {
        return execute("getApiInfo", request, GetApiInfoResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetsResponse>> getWidgets(GetWidgetsRequest request) {
        return execute("getWidgets", request, GetWidgetsResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<CreateWidgetResponse>> createWidget(CreateWidgetRequest request) {
        return execute("createWidget", request, CreateWidgetResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetResponse>> getWidget(GetWidgetRequest request) {
        return execute("getWidget", request, GetWidgetResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<DeleteWidgetResponse>> deleteWidget(DeleteWidgetRequest request) {
        return execute("deleteWidget", request, DeleteWidgetResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetBatchResponse>> getWidgetBatch(GetWidgetBatchRequest request) {
        return execute("getWidgetBatch", request, GetWidgetBatchResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<MirrorFieldsResponse>> mirrorFields(MirrorFieldsRequest request) {
        return execute("mirrorFields", request, MirrorFieldsResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<CheckQueryResponse>> checkQuery(CheckQueryRequest request) {
        return execute("checkQuery", request, CheckQueryResponse.class);
    }

    @Override
    public CompletableFuture<ServiceResult<CheckPathResponse>> checkPath(CheckPathRequest request) {
        return execute("checkPath", request, CheckPathResponse.class);
    }

    public List<ConformanceCase> cases() {
        return cases;
    }

    private <T> CompletableFuture<ServiceResult<T>> execute(String method, Object request, Class<T> responseType) {
        try {
            return CompletableFuture.completedFuture(answer(method, request, responseType));
        } catch (JsonException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> ServiceResult<T> answer(String method, Object request, Class<T> responseType) throws JsonException {
        List<ConformanceCase> candidates = cases.stream().filter(c -> method.equals(c.method())).toList();
        if (candidates.isEmpty()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "No tests found for method " + method + ".");
        }

        JsonNode actual = codec.writeTree(request);
        List<ConformanceCase> matches = candidates.stream()
                .filter(c -> requestOf(c).equals(BY_VALUE, actual))
                .toList();
        if (matches.size() != 1) {
            log.debug("{} fixture case(s) for {} match request {}", matches.size(), method, actual);
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST,
                    (matches.isEmpty() ? "No test" : "Multiple tests") + " found for method " + method
                            + " with request " + actual + ".");
        }

        ConformanceCase match = matches.get(0);
        log.debug("Answering {} from fixture case '{}'", method, match.test());
        if (match.expectsError()) {
            return ServiceResult.failure(codec.treeToValue(match.error(), ServiceError.class));
        }
        JsonNode response = match.response();
        return ServiceResult.value(response == null || response.isNull() ? null : codec.treeToValue(response, responseType));
    }

    private JsonNode requestOf(ConformanceCase c) {
        JsonNode request = c.request();
        return request == null || request.isNull() ? codec.getMapper().createObjectNode() : request;
    }

    /**
     * Scalar comparison for {@link JsonNode#equals(Comparator, JsonNode)}: numbers by value regardless of their
     * node type, and a number equal to text spelling it (for {@code NaN} and infinities written as strings).
     */
    private static int compareScalars(JsonNode a, JsonNode b) {
        if (a.equals(b)) return 0;
        if (a.isNumber() && b.isNumber()) {
            if (a.isIntegralNumber() && b.isIntegralNumber()) {
                return a.bigIntegerValue().compareTo(b.bigIntegerValue());
            }
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (a.isNumber() && b.isTextual()) return a.asText().equals(b.textValue()) ? 0 : 1;
        if (a.isTextual() && b.isNumber()) return a.textValue().equals(b.asText()) ? 0 : 1;
        return 1;
    }
}
