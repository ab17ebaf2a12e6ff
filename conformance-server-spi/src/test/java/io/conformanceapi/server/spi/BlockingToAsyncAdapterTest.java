package io.conformanceapi.server.spi;

import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.CreateWidgetResponse;
import io.conformanceapi.core.GetApiInfoRequest;
import io.conformanceapi.core.GetApiInfoResponse;
import io.conformanceapi.core.GetWidgetRequest;
import io.conformanceapi.core.GetWidgetResponse;
import io.conformanceapi.core.ServiceResult;
import io.conformanceapi.core.Widget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConformanceApi} via {@link BlockingToAsyncAdapter}.
 */
class BlockingToAsyncAdapterTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsBlockingCallsOnTheExecutor() throws Exception {
        ConformanceApi api = new BlockingToAsyncAdapter(new ReferenceConformanceApi(), executor);

        ServiceResult<CreateWidgetResponse> created = api.createWidget(
                new CreateWidgetRequest(Optional.of(Widget.of("one", BigDecimal.TEN)))).get(5, TimeUnit.SECONDS);
        ServiceResult<GetWidgetResponse> read = api.getWidget(
                new GetWidgetRequest(Optional.of(1), Optional.empty())).get(5, TimeUnit.SECONDS);

        assertThat(created).isInstanceOf(ServiceResult.Value.class);
        assertThat(((ServiceResult.Value<GetWidgetResponse>) read).value().widget().flatMap(Widget::name)).contains("one");
    }

    @Test
    void checkedExceptionsFailTheFuture() {
        BlockingConformanceApi failing = (BlockingConformanceApi) Proxy.newProxyInstance(
                getClass().getClassLoader(),
                new Class<?>[]{BlockingConformanceApi.class},
                (proxy, method, args) -> {
                    throw new IOException("disk on fire");
                });
        ConformanceApi api = new BlockingToAsyncAdapter(failing, executor);

        assertThatThrownBy(() -> api.getApiInfo(new GetApiInfoRequest()).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BlockingToAsyncAdapter.AsyncServiceException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void nullResultsPassThroughUntouched() throws Exception {
        BlockingConformanceApi broken = (BlockingConformanceApi) Proxy.newProxyInstance(
                getClass().getClassLoader(),
                new Class<?>[]{BlockingConformanceApi.class},
                (proxy, method, args) -> null);
        ConformanceApi api = new BlockingToAsyncAdapter(broken, executor);

        ServiceResult<GetApiInfoResponse> result = api.getApiInfo(new GetApiInfoRequest()).get(5, TimeUnit.SECONDS);

        assertThat(result).isNull();
    }
}
