package io.conformanceapi.server.spi;

import io.conformanceapi.core.Answer;
import io.conformanceapi.core.CheckPathRequest;
import io.conformanceapi.core.CheckPathResponse;
import io.conformanceapi.core.CheckQueryRequest;
import io.conformanceapi.core.CheckQueryResponse;
import io.conformanceapi.core.CreateWidgetRequest;
import io.conformanceapi.core.CreateWidgetResponse;
import io.conformanceapi.core.DeleteWidgetRequest;
import io.conformanceapi.core.DeleteWidgetResponse;
import io.conformanceapi.core.ErrorCodes;
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
import io.conformanceapi.core.Protocol;
import io.conformanceapi.core.ServiceResult;
import io.conformanceapi.core.Widget;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference in-memory {@link BlockingConformanceApi}.
 *
 * <p>Good for unit tests and local runs. Not intended for production: nothing is persisted and concurrent
 * writers to the same widget are not coordinated beyond the map's own atomicity.
 *
 * <p>Each stored widget carries an opaque, quoted eTag {@code "<internal-id>:<revision>"}.
 */
public final class ReferenceConformanceApi implements BlockingConformanceApi {

    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final Map<Integer, StoredWidget> widgets = new ConcurrentSkipListMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final AtomicLong revisions = new AtomicLong();
    private final int maxBatchSize;

    public ReferenceConformanceApi() {
        this(DEFAULT_MAX_BATCH_SIZE);
    }

    public ReferenceConformanceApi(int maxBatchSize) {
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public ServiceResult<GetApiInfoResponse> getApiInfo(GetApiInfoRequest request) {
        return ServiceResult.value(GetApiInfoResponse.of(Protocol.SERVICE_NAME, Protocol.SERVICE_VERSION));
    }

    @Override
    public ServiceResult<GetWidgetsResponse> getWidgets(GetWidgetsRequest request) {
        String query = request.query().map(q -> q.toLowerCase(Locale.ROOT)).orElse(null);
        List<Widget> matches = new ArrayList<>();
        for (StoredWidget stored : widgets.values()) {
            String name = stored.widget().name().orElse("");
            if (query == null || name.toLowerCase(Locale.ROOT).contains(query)) {
                matches.add(stored.widget());
            }
        }
        return ServiceResult.value(GetWidgetsResponse.of(matches));
    }

    @Override
    public ServiceResult<CreateWidgetResponse> createWidget(CreateWidgetRequest request) {
        if (request.widget().isEmpty()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "Widget is required.");
        }
        Widget requested = request.widget().get();
        if (requested.name().map(String::isBlank).orElse(true)) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "Widget name is required.");
        }

        int id = nextId.getAndIncrement();
        StoredWidget stored = store(requested.withId(id));
        return ServiceResult.value(new CreateWidgetResponse(
                Optional.of(stored.widget()),
                Optional.of("/widgets/" + id),
                Optional.of(stored.eTag())));
    }

    @Override
    public ServiceResult<GetWidgetResponse> getWidget(GetWidgetRequest request) {
        if (request.id().isEmpty()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "Widget ID is required.");
        }
        StoredWidget stored = widgets.get(request.id().get());
        if (stored == null) {
            return ServiceResult.failure(ErrorCodes.NOT_FOUND, "Widget not found.");
        }
        if (request.ifNotETag().map(stored.eTag()::equals).orElse(false)) {
            return ServiceResult.value(GetWidgetResponse.notModified(stored.eTag()));
        }
        return ServiceResult.value(GetWidgetResponse.fresh(stored.widget(), stored.eTag()));
    }

    @Override
    public ServiceResult<DeleteWidgetResponse> deleteWidget(DeleteWidgetRequest request) {
        if (request.id().isEmpty()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "Widget ID is required.");
        }
        int id = request.id().get();
        StoredWidget stored = widgets.get(id);
        if (stored == null) {
            return ServiceResult.value(DeleteWidgetResponse.notFoundResponse());
        }
        if (request.ifETag().isPresent() && !request.ifETag().get().equals(stored.eTag())) {
            return ServiceResult.value(DeleteWidgetResponse.conflictResponse());
        }
        // a concurrent delete or re-store between get and remove reads as not found
        if (!widgets.remove(id, stored)) {
            return ServiceResult.value(DeleteWidgetResponse.notFoundResponse());
        }
        return ServiceResult.value(DeleteWidgetResponse.deleted());
    }

    @Override
    public ServiceResult<GetWidgetBatchResponse> getWidgetBatch(GetWidgetBatchRequest request) {
        if (request.ids().isEmpty()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, "Widget IDs are required.");
        }
        List<Integer> ids = request.ids().get();
        if (ids.size() > maxBatchSize) {
            return ServiceResult.failure(ErrorCodes.REQUEST_TOO_LARGE, "Too many widget IDs (max " + maxBatchSize + ").");
        }

        List<ServiceResult<Widget>> results = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            StoredWidget stored = id == null ? null : widgets.get(id);
            results.add(stored == null
                    ? ServiceResult.failure(ErrorCodes.NOT_FOUND, "Widget not found.")
                    : ServiceResult.value(stored.widget()));
        }
        return ServiceResult.value(GetWidgetBatchResponse.of(results));
    }

    @Override
    public ServiceResult<MirrorFieldsResponse> mirrorFields(MirrorFieldsRequest request) {
        return ServiceResult.value(MirrorFieldsResponse.echo(request));
    }

    @Override
    public ServiceResult<CheckQueryResponse> checkQuery(CheckQueryRequest request) {
        Optional<String> invalid = invalidAnswer(request.enumValue());
        if (invalid.isPresent()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, invalid.get());
        }
        return ServiceResult.value(CheckQueryResponse.echo(request));
    }

    @Override
    public ServiceResult<CheckPathResponse> checkPath(CheckPathRequest request) {
        Optional<String> invalid = invalidAnswer(request.enumValue());
        if (invalid.isPresent()) {
            return ServiceResult.failure(ErrorCodes.INVALID_REQUEST, invalid.get());
        }
        return ServiceResult.value(CheckPathResponse.echo(request));
    }

    /**
     * Returns the current eTag of a stored widget.
     */
    public Optional<String> eTagOf(int id) {
        StoredWidget stored = widgets.get(id);
        return stored == null ? Optional.empty() : Optional.of(stored.eTag());
    }

    private StoredWidget store(Widget widget) {
        String internalId = UUID.randomUUID().toString().substring(0, 8);
        StoredWidget stored = new StoredWidget(widget, "\"" + internalId + ":" + revisions.incrementAndGet() + "\"");
        widgets.put(widget.id().orElseThrow(), stored);
        return stored;
    }

    private static Optional<String> invalidAnswer(Optional<Answer> answer) {
        return answer.filter(a -> !a.isKnown()).map(a -> "Invalid enum value: " + a.tag());
    }

    private record StoredWidget(Widget widget, String eTag) {}
}
