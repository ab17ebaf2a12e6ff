package io.conformanceapi.server.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.conformanceapi.core.ConformanceException.ResultContractViolation;
import io.conformanceapi.core.ErrorCodes;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.server.core.handlers.BindingContext;
import io.conformanceapi.server.core.handlers.RequestBinder;
import io.conformanceapi.server.core.handlers.ResponseShaper;
import io.conformanceapi.server.core.routing.Route;
import io.conformanceapi.server.core.routing.RouteMatch;
import io.conformanceapi.server.core.routing.RouteTable;
import io.conformanceapi.server.spi.ConformanceApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Framework-neutral HTTP handler serving the conformance API.
 *
 * <p>Each request is routed through the static {@link ConformanceRoutes} table, bound into a typed request,
 * passed to the {@link ConformanceApi} and shaped back into a response. The handler never blocks: the
 * returned future completes when the API call does.
 *
 * <pre>{@code
 * ConformanceApiHandler handler = ConformanceApiHandler.builder(api)
 *     .objectMapper(mapper)  // optional
 *     .build();
 * }</pre>
 */
public final class ConformanceApiHandler {
    private static final Logger log = LoggerFactory.getLogger(ConformanceApiHandler.class);

    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred.";

    private final ResponseShaper shaper;
    private final RouteTable routes;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param api the API service (required)
     * @return a new builder instance
     */
    public static Builder builder(ConformanceApi api) {
        return new Builder(api);
    }

    private ConformanceApiHandler(Builder builder) {
        JacksonJsonCodec codec = builder.mapper != null
                ? new JacksonJsonCodec(builder.mapper)
                : new JacksonJsonCodec();
        this.shaper = new ResponseShaper(codec);
        this.routes = ConformanceRoutes.table(builder.api, new RequestBinder(codec), shaper);
    }

    /**
     * Builder for {@link ConformanceApiHandler}.
     */
    public static final class Builder {
        private final ConformanceApi api;
        private ObjectMapper mapper;

        private Builder(ConformanceApi api) {
            this.api = Objects.requireNonNull(api, "api");
        }

        /**
         * Sets the mapper for request and response bodies. Default: {@link JacksonJsonCodec#newObjectMapper()}.
         */
        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public ConformanceApiHandler build() {
            return new ConformanceApiHandler(this);
        }
    }

    /**
     * Shapes an error raised by the host before a request could be handed to {@link #handle}.
     */
    public ServerResponse error(ServiceError error) {
        return shaper.error(error);
    }

    /**
     * Handles one request.
     *
     * @param req the incoming request
     * @return a future that always completes normally with the response
     */
    public CompletableFuture<ServerResponse> handle(ServerRequest req) {
        String rawPath = req.uri().getRawPath();
        Optional<RouteMatch> match = routes.find(req.method(), rawPath);
        if (match.isEmpty()) {
            log.debug("No route for {} {}", req.method(), rawPath);
            return CompletableFuture.completedFuture(
                    shaper.error(ServiceError.of(ErrorCodes.NOT_FOUND, "No route for " + req.method() + " " + rawPath)));
        }

        Route route = match.get().route();
        log.debug("Dispatching {} {} to {}", req.method(), rawPath, route.operation());

        CompletableFuture<ServerResponse> pending;
        try {
            pending = route.endpoint().dispatch(new BindingContext(req, match.get().pathParams()));
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending.exceptionally(t -> internalError(route.operation(), t));
    }

    private ServerResponse internalError(String operation, Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof ResultContractViolation) {
            log.error("{} produced an invalid result", operation, cause);
            return shaper.error(ServiceError.of(ErrorCodes.INTERNAL_ERROR, ResultContractViolation.MESSAGE));
        }
        log.error("{} failed", operation, cause);
        return shaper.error(ServiceError.of(ErrorCodes.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
