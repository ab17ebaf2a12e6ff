package io.conformanceapi.conformance;

import io.conformanceapi.conformance.ConformanceServerConfiguration.ServiceKind;
import io.conformanceapi.core.ErrorCodes;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.json.jackson.JacksonJsonCodec;
import io.conformanceapi.json.jackson.JsonException;
import io.conformanceapi.server.core.ConformanceApiHandler;
import io.conformanceapi.server.core.HttpMethod;
import io.conformanceapi.server.core.ResponseBody;
import io.conformanceapi.server.core.ServerRequest;
import io.conformanceapi.server.core.ServerResponse;
import io.conformanceapi.server.spi.BlockingToAsyncAdapter;
import io.conformanceapi.server.spi.ConformanceApi;
import io.conformanceapi.server.spi.ReferenceConformanceApi;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Hosts {@link ConformanceApiHandler} on Javalin. Every path and method is forwarded to the handler.
 */
public final class ConformanceServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConformanceServer.class);

    private final ConformanceApiHandler handler;
    private final ExecutorService executor; // null unless serving a blocking API
    private Javalin app;

    private ConformanceServer(ConformanceApiHandler handler, ExecutorService executor) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.executor = executor;
    }

    public static void main(String[] args) throws Exception {
        ConformanceServerConfiguration config = ConformanceServerConfiguration.load();
        ConformanceServer server = create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "conformance-server-shutdown"));
        server.start(config.port());
    }

    /**
     * Builds a server for the configured API service. Fixture cases are loaded eagerly.
     */
    public static ConformanceServer create(ConformanceServerConfiguration config) throws IOException, JsonException {
        if (config.service() == ServiceKind.REFERENCE) {
            ExecutorService executor = VirtualThreads.newExecutor("conformance-reference");
            ConformanceApi api = new BlockingToAsyncAdapter(new ReferenceConformanceApi(config.maxBatchSize()), executor);
            log.info("Serving the in-memory reference service (max batch size {})", config.maxBatchSize());
            return new ConformanceServer(ConformanceApiHandler.builder(api).build(), executor);
        }

        JacksonJsonCodec codec = new JacksonJsonCodec();
        List<ConformanceCase> cases;
        if (config.fixtures().isPresent()) {
            cases = ConformanceCases.fromPath(codec, Path.of(config.fixtures().get()));
        } else {
            cases = ConformanceCases.fromClasspath(codec, ConformanceCases.DEFAULT_RESOURCE);
        }
        log.info("Serving {} fixture case(s) from {}", cases.size(),
                config.fixtures().orElse("classpath:" + ConformanceCases.DEFAULT_RESOURCE));
        return new ConformanceServer(ConformanceApiHandler.builder(new FixtureConformanceApi(cases, codec)).build(), null);
    }

    /**
     * Starts listening.
     *
     * @param port the port, or {@code 0} for an ephemeral one
     * @return this server
     */
    public ConformanceServer start(int port) {
        if (app != null) throw new IllegalStateException("already started");
        Handler forward = this::handle;
        app = Javalin.create();
        for (String path : List.of("/", "/*")) {
            app.get(path, forward);
            app.post(path, forward);
            app.put(path, forward);
            app.patch(path, forward);
            app.delete(path, forward);
        }
        app.start(port);
        log.info("Conformance server listening on http://localhost:{}", app.port());
        return this;
    }

    /** The bound port; only valid after {@link #start(int)}. */
    public int port() {
        if (app == null) throw new IllegalStateException("not started");
        return app.port();
    }

    @Override
    public void close() {
        if (app != null) {
            app.stop();
            app = null;
        }
        if (executor != null) executor.shutdownNow();
    }

    private void handle(Context ctx) {
        String target = ctx.req().getRequestURI();
        Optional<HttpMethod> method = HttpMethod.parse(ctx.method().name());
        if (method.isEmpty()) {
            write(ctx, handler.error(ServiceError.of(ErrorCodes.NOT_FOUND, "No route for " + ctx.method().name() + " " + target)));
            return;
        }
        URI uri;
        try {
            uri = ServerRequest.target(target, ctx.req().getQueryString());
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting unparseable request target {}", target, e);
            write(ctx, handler.error(ServiceError.of(ErrorCodes.INVALID_REQUEST, "Invalid request target.")));
            return;
        }

        ServerRequest request = new ServerRequest(method.get(), uri, toHeaders(ctx), bodyOrNull(ctx));
        ctx.future(() -> handler.handle(request).thenAccept(response -> write(ctx, response)));
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    private static InputStream bodyOrNull(Context ctx) {
        byte[] body = ctx.bodyAsBytes();
        return body.length == 0 ? null : new ByteArrayInputStream(body);
    }

    private static void write(Context ctx, ServerResponse response) {
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }
        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        }
    }
}
