package io.conformanceapi.server.core.routing;

import io.conformanceapi.server.core.HttpMethod;
import io.conformanceapi.server.core.ResponseBody;
import io.conformanceapi.server.core.ServerResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteTableTest {

    private static final Endpoint NOOP =
            ctx -> CompletableFuture.completedFuture(new ServerResponse(204, new ResponseBody.Empty()));

    @Test
    void firstDeclaredRouteWins() {
        RouteTable table = RouteTable.builder()
                .route(HttpMethod.POST, "/widgets/get", "batch", NOOP)
                .route(HttpMethod.POST, "/widgets/:id", "byId", NOOP)
                .build();

        assertThat(table.find(HttpMethod.POST, "/widgets/get"))
                .hasValueSatisfying(m -> assertThat(m.route().operation()).isEqualTo("batch"));
        assertThat(table.find(HttpMethod.POST, "/widgets/7"))
                .hasValueSatisfying(m -> assertThat(m.pathParams()).containsEntry("id", "7"));
    }

    @Test
    void methodMustMatch() {
        RouteTable table = RouteTable.builder().route(HttpMethod.GET, "/widgets", "list", NOOP).build();

        assertThat(table.find(HttpMethod.GET, "/widgets")).isPresent();
        assertThat(table.find(HttpMethod.PUT, "/widgets")).isEmpty();
    }

    @Test
    void duplicateRoutesAreRejected() {
        RouteTable.Builder builder = RouteTable.builder().route(HttpMethod.GET, "/", "info", NOOP);

        assertThatThrownBy(() -> builder.route(HttpMethod.GET, "/", "again", NOOP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate route");
    }
}
