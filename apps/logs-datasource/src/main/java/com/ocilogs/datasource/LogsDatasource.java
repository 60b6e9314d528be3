package com.ocilogs.datasource;

import com.ocilogs.DatasourceException;
import com.ocilogs.frame.DataFrame;
import com.ocilogs.frame.ResultFramer;
import com.ocilogs.model.OciResource;
import com.ocilogs.oci.ClientRegistry;
import com.ocilogs.oci.ResolvedTenancy;
import com.ocilogs.query.ConnectivityException;
import com.ocilogs.query.HealthResult;
import com.ocilogs.query.QueryContext;
import com.ocilogs.query.QueryExecutor;
import com.ocilogs.query.QueryRequest;
import com.ocilogs.query.RawResultSet;
import com.ocilogs.query.RequestCancelledException;
import com.ocilogs.settings.DatasourceSettings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * One configured datasource: its resolved tenancies, its cache and the query pipeline.
 */
public class LogsDatasource implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger("DS.LogsDatasource");

    private final String uid;
    private final DatasourceSettings settings;
    private final ClientRegistry registry;
    private final QueryExecutor executor;
    private final ResultFramer framer;

    public LogsDatasource(String uid,
                          DatasourceSettings settings,
                          ClientRegistry registry,
                          QueryExecutor executor,
                          ResultFramer framer) {
        this.uid = uid;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.framer = Objects.requireNonNull(framer, "framer");
    }

    /**
     * Runs every query of the batch. A failing query yields a failed result for its refId and
     * does not stop the others; only cancellation ends the batch.
     */
    public List<QueryResult> query(List<QueryRequest> queries, QueryContext context) {
        List<QueryResult> results = new ArrayList<>();
        for (QueryRequest query : queries) {
            String refId = query.refId() == null ? "A" : query.refId();
            try {
                ResolvedTenancy tenancy = registry.lookup(registry.accessKey(query.tenancy()));
                QueryRequest effective = withDefaults(query);
                RawResultSet raw = executor.execute(tenancy, effective, context);
                DataFrame frame = framer.frame(refId, raw, effective.timeRange(), effective.maxDataPoints());
                results.add(QueryResult.success(refId, frame));
            } catch (RequestCancelledException e) {
                throw e;
            } catch (DatasourceException e) {
                LOGGER.errorv("[QUERY-ERROR] requestId={0} datasource={1} refId={2}: {3}",
                        context.requestId(), uid, refId, e.getMessage());
                results.add(QueryResult.failure(refId, e.getMessage()));
            } catch (RuntimeException e) {
                LOGGER.errorf(e, "[QUERY-ERROR] requestId=%s datasource=%s refId=%s", context.requestId(), uid, refId);
                results.add(QueryResult.failure(refId, "query failed: " + e.getMessage()));
            }
        }
        return results;
    }

    private QueryRequest withDefaults(QueryRequest query) {
        String environment = query.environment() == null || query.environment().isBlank()
                ? settings.environment()
                : query.environment();
        return new QueryRequest(environment, query.tenancyMode(), query.queryType(), query.region(),
                query.tenancyOCID(), query.tenancy(), query.searchQuery(), query.maxDataPoints(),
                query.panelId(), query.refId(), executor.effectiveRange(query.timeRange()));
    }

    /**
     * Checks every tenancy; the first failure makes the datasource unhealthy.
     */
    public HealthResult checkHealth(QueryContext context) {
        for (ResolvedTenancy tenancy : registry.tenancies().values()) {
            try {
                executor.checkHealth(tenancy, settings.environment(), context);
            } catch (ConnectivityException e) {
                LOGGER.warnv("[HEALTH] requestId={0} datasource={1} tenancy={2} status={3}",
                        context.requestId(), uid, tenancy.key(), e.status());
                String body = e.body() == null || e.body().isBlank() ? "" : ": " + e.body();
                return HealthResult.failed(e.getMessage() + body);
            }
        }
        return HealthResult.ok();
    }

    public List<OciResource> tenancies() {
        return registry.tenancies().keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(key -> new OciResource(key, key))
                .toList();
    }

    public List<String> subscribedRegions(String tenancy, QueryContext context) {
        return executor.subscribedRegions(registry.lookup(registry.accessKey(tenancy)), context);
    }

    public List<String> fieldValues(FieldValuesRequest request, QueryContext context) {
        ResolvedTenancy tenancy = registry.lookup(registry.accessKey(request.tenancy()));
        Instant from = request.timeStart() == null ? null : Instant.ofEpochMilli(request.timeStart());
        Instant to = request.timeEnd() == null ? null : Instant.ofEpochMilli(request.timeEnd());
        return executor.fieldValues(tenancy, request.region(), request.getquery(), request.field(), from, to, context);
    }

    public String uid() {
        return uid;
    }

    public DatasourceSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        registry.close();
    }
}
