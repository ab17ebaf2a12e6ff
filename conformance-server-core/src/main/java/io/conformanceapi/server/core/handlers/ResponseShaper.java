package io.conformanceapi.server.core.handlers;

import io.conformanceapi.core.CheckPathResponse;
import io.conformanceapi.core.CheckQueryResponse;
import io.conformanceapi.core.ConformanceException.PayloadSerializationFailure;
import io.conformanceapi.core.ConformanceException.ResultContractViolation;
import io.conformanceapi.core.CreateWidgetResponse;
import io.conformanceapi.core.DeleteWidgetResponse;
import io.conformanceapi.core.GetApiInfoResponse;
import io.conformanceapi.core.GetWidgetBatchResponse;
import io.conformanceapi.core.GetWidgetResponse;
import io.conformanceapi.core.GetWidgetsResponse;
import io.conformanceapi.core.MirrorFieldsResponse;
import io.conformanceapi.core.Protocol;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.core.ServiceResult;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.json.jackson.JsonException;
import io.conformanceapi.server.core.ResponseBody;
import io.conformanceapi.server.core.ServerResponse;
import io.conformanceapi.server.core.StandardErrorCodes;

import java.util.Objects;
import java.util.function.Function;

/**
 * Turns each endpoint's {@link ServiceResult} into an HTTP response.
 *
 * <p>A failure always becomes the error body with the status from {@link StandardErrorCodes}. A value is
 * inspected in the endpoint's fixed priority order. A {@code null} result, a value arm holding {@code null},
 * or a value that matches none of the endpoint's shapes raises {@link ResultContractViolation}.
 */
public final class ResponseShaper {
    private final JacksonJsonCodec codec;

    public ResponseShaper(JacksonJsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public ServerResponse getApiInfo(ServiceResult<GetApiInfoResponse> result) {
        return shape("getApiInfo", result, value -> json(200, value));
    }

    public ServerResponse getWidgets(ServiceResult<GetWidgetsResponse> result) {
        return shape("getWidgets", result, value -> json(200, value));
    }

    public ServerResponse createWidget(ServiceResult<CreateWidgetResponse> result) {
        return shape("createWidget", result, value -> {
            ServerResponse response = value.widget().isPresent()
                    ? json(201, value.widget().get())
                    : new ServerResponse(201, new ResponseBody.Empty());
            value.url().ifPresent(url -> response.header(Protocol.H_LOCATION, url));
            value.eTag().ifPresent(tag -> response.header(Protocol.H_ETAG, tag));
            return response;
        });
    }

    public ServerResponse getWidget(ServiceResult<GetWidgetResponse> result) {
        return shape("getWidget", result, value -> {
            ServerResponse response;
            if (value.widget().isPresent()) {
                response = json(200, value.widget().get());
            } else if (value.notModified().orElse(false)) {
                response = new ServerResponse(304, new ResponseBody.Empty());
            } else {
                return null;
            }
            value.eTag().ifPresent(tag -> response.header(Protocol.H_ETAG, tag));
            return response;
        });
    }

    public ServerResponse deleteWidget(ServiceResult<DeleteWidgetResponse> result) {
        return shape("deleteWidget", result, value -> {
            if (value.notFound().orElse(false)) return new ServerResponse(404, new ResponseBody.Empty());
            if (value.conflict().orElse(false)) return new ServerResponse(409, new ResponseBody.Empty());
            return new ServerResponse(204, new ResponseBody.Empty());
        });
    }

    public ServerResponse getWidgetBatch(ServiceResult<GetWidgetBatchResponse> result) {
        return shape("getWidgetBatch", result, value -> value.results().map(results -> json(200, results)).orElse(null));
    }

    public ServerResponse mirrorFields(ServiceResult<MirrorFieldsResponse> result) {
        return shape("mirrorFields", result, value -> json(200, value));
    }

    public ServerResponse checkQuery(ServiceResult<CheckQueryResponse> result) {
        return shape("checkQuery", result, value -> json(200, value));
    }

    public ServerResponse checkPath(ServiceResult<CheckPathResponse> result) {
        return shape("checkPath", result, value -> json(200, value));
    }

    /**
     * Error response for a service error; status from {@link StandardErrorCodes}.
     */
    public ServerResponse error(ServiceError error) {
        return json(StandardErrorCodes.statusFor(error.code()), error);
    }

    /**
     * @param onValue maps a non-null value to a response, or returns {@code null} when no shape applies
     */
    private <T> ServerResponse shape(String endpoint, ServiceResult<T> result, Function<T, ServerResponse> onValue) {
        if (result instanceof ServiceResult.Failure<T> failure) {
            return error(failure.error());
        }
        if (result instanceof ServiceResult.Value<T> value && value.value() != null) {
            ServerResponse response = onValue.apply(value.value());
            if (response != null) return response;
        }
        throw new ResultContractViolation(endpoint);
    }

    private ServerResponse json(int status, Object body) {
        try {
            return new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(body)))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        } catch (JsonException e) {
            throw new PayloadSerializationFailure("Failed to write " + body.getClass().getSimpleName(), e);
        }
    }
}
