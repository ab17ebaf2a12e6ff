package io.conformanceapi.server.core.routing;

import java.util.Map;

/**
 * A matched route with its decoded path parameters.
 */
public record RouteMatch(Route route, Map<String, String> pathParams) {}
