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

import java.util.concurrent.CompletableFuture;

/**
 * The conformance API capability, one method per HTTP endpoint.
 *
 * <p>Every method returns immediately and completes the future with either a value or an error. The HTTP
 * layer never inspects the payload beyond the fields that drive status codes and headers, and never retries.
 *
 * <p>Implementations own all validation: the HTTP layer forwards requests whose fields may be absent or
 * carry values (such as unknown enum tags) the service must reject.
 *
 * @see BlockingConformanceApi
 * @see BlockingToAsyncAdapter
 */
public interface ConformanceApi {

    /** {@code GET /}. */
    CompletableFuture<ServiceResult<GetApiInfoResponse>> getApiInfo(GetApiInfoRequest request);

    /** {@code GET /widgets}. */
    CompletableFuture<ServiceResult<GetWidgetsResponse>> getWidgets(GetWidgetsRequest request);

    /** {@code POST /widgets}. */
    CompletableFuture<ServiceResult<CreateWidgetResponse>> createWidget(CreateWidgetRequest request);

    /** {@code GET /widgets/:id}. */
    CompletableFuture<ServiceResult<GetWidgetResponse>> getWidget(GetWidgetRequest request);

    /** {@code DELETE /widgets/:id}. */
    CompletableFuture<ServiceResult<DeleteWidgetResponse>> deleteWidget(DeleteWidgetRequest request);

    /** {@code POST /widgets/get}. */
    CompletableFuture<ServiceResult<GetWidgetBatchResponse>> getWidgetBatch(GetWidgetBatchRequest request);

    /** {@code POST /mirrorFields}. */
    CompletableFuture<ServiceResult<MirrorFieldsResponse>> mirrorFields(MirrorFieldsRequest request);

    /** {@code GET /checkQuery}. */
    CompletableFuture<ServiceResult<CheckQueryResponse>> checkQuery(CheckQueryRequest request);

    /** {@code GET /checkPath/...}. */
    CompletableFuture<ServiceResult<CheckPathResponse>> checkPath(CheckPathRequest request);
}
