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

/**
 * Blocking counterpart of {@link ConformanceApi}.
 *
 * <p>This SPI is intentionally minimal. Wrap implementations in {@link BlockingToAsyncAdapter} to run them
 * off the HTTP threads.
 */
public interface BlockingConformanceApi {

    ServiceResult<GetApiInfoResponse> getApiInfo(GetApiInfoRequest request) throws Exception;

    ServiceResult<GetWidgetsResponse> getWidgets(GetWidgetsRequest request) throws Exception;

    ServiceResult<CreateWidgetResponse> createWidget(CreateWidgetRequest request) throws Exception;

    ServiceResult<GetWidgetResponse> getWidget(GetWidgetRequest request) throws Exception;

    ServiceResult<DeleteWidgetResponse> deleteWidget(DeleteWidgetRequest request) throws Exception;

    ServiceResult<GetWidgetBatchResponse> getWidgetBatch(GetWidgetBatchRequest request) throws Exception;

    ServiceResult<MirrorFieldsResponse> mirrorFields(MirrorFieldsRequest request) throws Exception;

    ServiceResult<CheckQueryResponse> checkQuery(CheckQueryRequest request) throws Exception;

    ServiceResult<CheckPathResponse> checkPath(CheckPathRequest request) throws Exception;
}
