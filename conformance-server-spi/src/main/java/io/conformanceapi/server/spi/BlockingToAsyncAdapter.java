package io.conformanceapi.server.spi;

import io.conformanceapi.core.CheckPathRequest;
import io.conformanceapi.core.CheckPathResponse;
import io.conformanceapi.core.CheckQueryRequest;
import io.conformanceapi.core.CheckQueryResponse;
import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.CreateWidgetResponse;
import io.conformanceapi.core.DeleteWidgetRequest;
import io.conformanceapi.core.DeleteWidgetResponse;
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
import io.conformanceapi.core.ServiceResult;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapts a blocking {@link BlockingConformanceApi} to the asynchronous {@link ConformanceApi} interface.
 *
 * <p>Each call runs on the provided executor, so a slow call never holds an HTTP thread. The calls still
 * block a thread from the executor pool.
 *
 * @see ConformanceApi
 * @see BlockingConformanceApi
 */
public final class BlockingToAsyncAdapter implements ConformanceApi {

    private final BlockingConformanceApi delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking service.
     *
     * @param delegate the blocking service to wrap
     * @param executor executor to run blocking calls on
     */
    public BlockingToAsyncAdapter(BlockingConformanceApi delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<ServiceResult<GetApiInfoResponse>> getApiInfo(GetApiInfoRequest request) {
        return supply(() -> delegate.getApiInfo(request));
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetsResponse>> getWidgets(GetWidgetsRequest request) {
        return supply(() -> delegate.getWidgets(request));
    }

    @Override
    public CompletableFuture<ServiceResult<CreateWidgetResponse>> createWidget(CreateWidgetRequest request) {
        return supply(() -> delegate.createWidget(request));
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetResponse>> getWidget(GetWidgetRequest request) {
        return supply(() -> delegate.getWidget(request));
    }

    @Override
    public CompletableFuture<ServiceResult<DeleteWidgetResponse>> deleteWidget(DeleteWidgetRequest request) {
        return supply(() -> delegate.deleteWidget(request));
    }

    @Override
    public CompletableFuture<ServiceResult<GetWidgetBatchResponse>> getWidgetBatch(GetWidgetBatchRequest request) {
        return supply(() -> delegate.getWidgetBatch(request));
    }

    @Override
    public CompletableFuture<ServiceResult<MirrorFieldsResponse>> mirrorFields(MirrorFieldsRequest request) {
        return supply(() -> delegate.mirrorFields(request));
    }

    @Override
    public CompletableFuture<ServiceResult<CheckQueryResponse>> checkQuery(CheckQueryRequest request) {
        return supply(() -> delegate.checkQuery(request));
    }

    @Override
    public CompletableFuture<ServiceResult<CheckPathResponse>> checkPath(CheckPathRequest request) {
        return supply(() -> delegate.checkPath(request));
    }

    private <T> CompletableFuture<T> supply(Callable<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new AsyncServiceException(e);
    }

    /**
     * Exception wrapper for checked exceptions from blocking service calls.
     */
    public static final class AsyncServiceException extends RuntimeException {
        public AsyncServiceException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
