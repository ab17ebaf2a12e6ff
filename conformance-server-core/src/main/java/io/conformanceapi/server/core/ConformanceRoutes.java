package io.conformanceapi.server.core;

import io.conformanceapi.server.core.handlers.RequestBinder;
import io.conformanceapi.server.core.handlers.ResponseShaper;
import io.conformanceapi.server.core.routing.RouteTable;
import io.conformanceapi.server.spi.ConformanceApi;

/**
 * The static route table of the conformance API.
 *
 * <p>{@code POST /widgets/get} is declared before {@code /widgets/:id} so the literal segment wins.
 */
public final class ConformanceRoutes {
    private ConformanceRoutes() {}

    public static final String CHECK_PATH_TEMPLATE =
            "/checkPath/:string/:boolean/:double/:int32/:int64/:decimal/:enum/:datetime";

    public static RouteTable table(ConformanceApi api, RequestBinder binder, ResponseShaper shaper) {
        return RouteTable.builder()
                .route(HttpMethod.GET, "/", "getApiInfo",
                        ctx -> api.getApiInfo(binder.getApiInfo(ctx)).thenApply(shaper::getApiInfo))
                .route(HttpMethod.GET, "/widgets", "getWidgets",
                        ctx -> api.getWidgets(binder.getWidgets(ctx)).thenApply(shaper::getWidgets))
                .route(HttpMethod.POST, "/widgets", "createWidget",
                        ctx -> api.createWidget(binder.createWidget(ctx)).thenApply(shaper::createWidget))
                .route(HttpMethod.POST, "/widgets/get", "getWidgetBatch",
                        ctx -> api.getWidgetBatch(binder.getWidgetBatch(ctx)).thenApply(shaper::getWidgetBatch))
                .route(HttpMethod.GET, "/widgets/:id", "getWidget",
                        ctx -> api.getWidget(binder.getWidget(ctx)).thenApply(shaper::getWidget))
                .route(HttpMethod.DELETE, "/widgets/:id", "deleteWidget",
                        ctx -> api.deleteWidget(binder.deleteWidget(ctx)).thenApply(shaper::deleteWidget))
                .route(HttpMethod.POST, "/mirrorFields", "mirrorFields",
                        ctx -> api.mirrorFields(binder.mirrorFields(ctx)).thenApply(shaper::mirrorFields))
                .route(HttpMethod.GET, "/checkQuery", "checkQuery",
                        ctx -> api.checkQuery(binder.checkQuery(ctx)).thenApply(shaper::checkQuery))
                .route(HttpMethod.GET, CHECK_PATH_TEMPLATE, "checkPath",
                        ctx -> api.checkPath(binder.checkPath(ctx)).thenApply(shaper::checkPath))
                .build();
    }
}
