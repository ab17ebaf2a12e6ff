package io.conformanceapi.server.core.handlers;

import io.conformanceapi.core.Answer;
import io.conformanceapi.core.CheckPathRequest;
import io.conformanceapi.core.CheckQueryRequest;
import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.DeleteWidgetRequest;
import io.conformanceapi.core.GetApiInfoRequest;
import io.conformanceapi.core.GetWidgetBatchRequest;
import io.conformanceapi.core.GetWidgetRequest;
import io.conformanceapi.core.GetWidgetsRequest;
import io.conformanceapi.core.MirrorFieldsRequest;
import io.conformanceapi.core.Protocol;
import io.conformanceapi.core.Widget;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.json.jackson.JsonException;
import io.conformanceapi.server.core.PrimitiveCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds the typed request of each endpoint from a {@link BindingContext}.
 *
 * <p>Binding never rejects a request. A query parameter, path segment, header or body that is missing or
 * fails to coerce leaves its field empty, and validation is left to the API service.
 */
public final class RequestBinder {
    private static final Logger log = LoggerFactory.getLogger(RequestBinder.class);

    public static final String P_ID = "id";

    private final JacksonJsonCodec codec;

    public RequestBinder(JacksonJsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public GetApiInfoRequest getApiInfo(BindingContext ctx) {
        return new GetApiInfoRequest();
    }

    public GetWidgetsRequest getWidgets(BindingContext ctx) {
        return new GetWidgetsRequest(ctx.query(Protocol.Q_QUERY).flatMap(PrimitiveCoercion::toText));
    }

    public CreateWidgetRequest createWidget(BindingContext ctx) {
        return new CreateWidgetRequest(jsonBody(ctx, Widget.class));
    }

    public GetWidgetRequest getWidget(BindingContext ctx) {
        return new GetWidgetRequest(
                ctx.path(P_ID).flatMap(PrimitiveCoercion::toInt32),
                ctx.header(Protocol.H_IF_NONE_MATCH));
    }

    public DeleteWidgetRequest deleteWidget(BindingContext ctx) {
        return new DeleteWidgetRequest(
                ctx.path(P_ID).flatMap(PrimitiveCoercion::toInt32),
                ctx.header(Protocol.H_IF_MATCH));
    }

    public GetWidgetBatchRequest getWidgetBatch(BindingContext ctx) {
        Optional<List<Integer>> ids = ctx.body().flatMap(bytes -> {
            try {
                return Optional.ofNullable(codec.readList(bytes, Integer.class));
            } catch (JsonException e) {
                log.debug("Unreadable widget id list, leaving ids unset: {}", e.getMessage());
                return Optional.empty();
            }
        });
        return new GetWidgetBatchRequest(ids);
    }

    public MirrorFieldsRequest mirrorFields(BindingContext ctx) {
        return jsonBody(ctx, MirrorFieldsRequest.class)
                .orElseGet(() -> new MirrorFieldsRequest(Optional.empty(), Optional.empty()));
    }

    public CheckQueryRequest checkQuery(BindingContext ctx) {
        Primitives p = Primitives.bind(ctx::query);
        return new CheckQueryRequest(p.string(), p.bool(), p.dbl(), p.int32(), p.int64(), p.decimal(), p.answer(), p.datetime());
    }

    public CheckPathRequest checkPath(BindingContext ctx) {
        Primitives p = Primitives.bind(ctx::path);
        return new CheckPathRequest(p.string(), p.bool(), p.dbl(), p.int32(), p.int64(), p.decimal(), p.answer(), p.datetime());
    }

    private <T> Optional<T> jsonBody(BindingContext ctx, Class<T> type) {
        return ctx.body().flatMap(bytes -> {
            try {
                return Optional.ofNullable(codec.readValue(bytes, type));
            } catch (JsonException e) {
                log.debug("Unreadable {} body, leaving it unset: {}", type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * The eight primitive fields shared by checkQuery and checkPath, coerced from one raw source.
     */
    private record Primitives(
            Optional<String> string,
            Optional<Boolean> bool,
            Optional<Double> dbl,
            Optional<Integer> int32,
            Optional<Long> int64,
            Optional<BigDecimal> decimal,
            Optional<Answer> answer,
            Optional<String> datetime
    ) {
        static Primitives bind(Function<String, Optional<String>> raw) {
            return new Primitives(
                    raw.apply(Protocol.F_STRING).flatMap(PrimitiveCoercion::toText),
                    raw.apply(Protocol.F_BOOLEAN).flatMap(PrimitiveCoercion::toBoolean),
                    raw.apply(Protocol.F_DOUBLE).flatMap(PrimitiveCoercion::toDouble),
                    raw.apply(Protocol.F_INT32).flatMap(PrimitiveCoercion::toInt32),
                    raw.apply(Protocol.F_INT64).flatMap(PrimitiveCoercion::toInt64),
                    raw.apply(Protocol.F_DECIMAL).flatMap(PrimitiveCoercion::toDecimal),
                    raw.apply(Protocol.F_ENUM).flatMap(PrimitiveCoercion::toAnswer),
                    raw.apply(Protocol.F_DATETIME).flatMap(PrimitiveCoercion::toDateTime));
        }
    }
}
