package io.conformanceapi.server.core.routing;

import io.conformanceapi.server.core.HttpMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered table of routes. Lookup tries routes in declaration order and returns the first whose
 * method and path template both match.
 *
 * <pre>{@code
 * RouteTable table = RouteTable.builder()
 *     .route(HttpMethod.GET, "/widgets/:id", "getWidget", ctx -> ...)
 *     .build();
 * }</pre>
 */
public final class RouteTable {
    private final List<Route> routes;

    private RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RouteMatch> find(HttpMethod method, String rawPath) {
        for (Route route : routes) {
            if (route.method() != method) continue;
            Optional<Map<String, String>> params = route.path().match(rawPath);
            if (params.isPresent()) return Optional.of(new RouteMatch(route, params.get()));
        }
        return Optional.empty();
    }

    public List<Route> routes() {
        return routes;
    }

    /**
     * Builder for {@link RouteTable}.
     */
    public static final class Builder {
        private final List<Route> routes = new ArrayList<>();

        private Builder() {}

        public Builder route(HttpMethod method, String template, String operation, Endpoint endpoint) {
            PathTemplate path = PathTemplate.parse(template);
            for (Route existing : routes) {
                if (existing.method() == method && existing.path().template().equals(template)) {
                    throw new IllegalArgumentException("duplicate route " + method + " " + template);
                }
            }
            routes.add(new Route(method, path, operation, endpoint));
            return this;
        }

        public RouteTable build() {
            return new RouteTable(routes);
        }
    }
}
