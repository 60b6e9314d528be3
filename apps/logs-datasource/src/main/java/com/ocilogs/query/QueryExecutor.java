package com.ocilogs.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.ocilogs.DatasourceException;
import com.ocilogs.cache.CachedLookup;
import com.ocilogs.cache.ResultCache;
import com.ocilogs.model.CompartmentPage;
import com.ocilogs.model.CompartmentSummary;
import com.ocilogs.model.LogSearch;
import com.ocilogs.model.OciResource;
import com.ocilogs.model.SearchPage;
import com.ocilogs.oci.RemoteServiceException;
import com.ocilogs.oci.ResolvedTenancy;
import com.ocilogs.settings.DatasourceSettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Runs the remote side of a query against one resolved tenancy.
 *
 * <p>Compartment listings follow continuation tokens up to the page cap and are served from the
 * {@link ResultCache} while fresh. Log searches fetch a single page. Every remote call is logged
 * with the request id and its duration; failures are reported as {@link RemoteCallException}
 * naming the operation and its parameters.
 */
public class QueryExecutor {

    private static final Logger LOGGER = Logger.getLogger("DS.QueryExecutor");

    public static final String ALL_SUBSCRIBED_REGIONS = "all-subscribed-region";
    static final String ROOT_SUFFIX = "(tenancy, shown as '/')";
    static final int HEALTH_SEARCH_LIMIT = 10;
    static final int DEFAULT_RANGE_MINUTES = 5;

    private final ResultCache cache;
    private final QueryOptions options;
    private final Clock clock;

    public QueryExecutor(ResultCache cache, QueryOptions options, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RawResultSet execute(ResolvedTenancy tenancy, QueryRequest request, QueryContext context) {
        QueryType type = request.type();
        LOGGER.debugv("[QUERY] requestId={0} refId={1} type={2} tenancy={3}",
                context.requestId(), request.refId(), type.wireName(), tenancy.key());
        switch (type) {
            case COMPARTMENTS:
                return compartmentTable(compartments(tenancy, request.region(), request.tenancyOCID(), context));
            case REGIONS:
                return RawResultSet.ofTable(List.of("text"),
                        regions(tenancy, request.region(), context).stream().map(List::of).toList(), false);
            case TEST:
                HealthResult health = checkHealth(tenancy, request.environment(), context);
                return RawResultSet.ofTable(List.of("status"), List.of(List.of(health.message())), false);
            case SEARCH_LOGS:
            default:
                return searchLogs(tenancy, request, context);
        }
    }

    /**
     * Active compartments under the tenancy root, full path names, root entry first.
     *
     * @param tenancyOcid OCID named by the request; the tenancy's own OCID is used unless this
     *                    is an OCID
     */
    public CompartmentListing compartments(ResolvedTenancy tenancy, String region, String tenancyOcid, QueryContext context) {
        String rootId = tenancyOcid != null && tenancyOcid.startsWith("ocid1.") ? tenancyOcid : tenancy.tenancyOcid();
        if (rootId.isBlank()) {
            throw new DatasourceException("no tenancy OCID available for tenancy " + tenancy.key());
        }
        String regionKey = region == null ? "" : region;
        CachedLookup<CompartmentListing> lookup = new CachedLookup<>(
                cache,
                "compartments/" + tenancy.key() + "/" + regionKey + "/" + rootId,
                CompartmentListing.class,
                options.refreshInterval(),
                clock,
                () -> listCompartments(tenancy, regionKey, rootId, context),
                CompartmentListing::cost);
        return lookup.get();
    }

    private CompartmentListing listCompartments(ResolvedTenancy tenancy, String region, String rootId, QueryContext context) {
        List<CompartmentSummary> fetched = new ArrayList<>();
        String pageToken = null;
        int pages = 0;
        boolean capReached = false;
        while (true) {
            context.checkCancelled("ListCompartments");
            String token = pageToken;
            CompartmentPage page = remote(context, "ListCompartments",
                    params("region", region, "compartmentId", rootId, "page", token),
                    () -> tenancy.connector().listCompartments(region, rootId, token));
            pages++;
            fetched.addAll(page.items());
            if (!page.hasNextPage()) {
                break;
            }
            if (pages >= options.compartmentMaxPages()) {
                capReached = true;
                LOGGER.warnv("[QUERY] requestId={0} ListCompartments alcanzó el límite de {1} páginas, resultado truncado. tenancy={2}",
                        context.requestId(), options.compartmentMaxPages(), tenancy.key());
                break;
            }
            pageToken = page.nextPage();
        }

        String tenancyName = remote(context, "GetTenancy",
                params("region", region, "tenancyId", rootId),
                () -> tenancy.connector().getTenancyName(region, rootId));

        List<OciResource> entries = new ArrayList<>();
        entries.add(new OciResource(tenancyName + ROOT_SUFFIX, rootId));
        entries.addAll(pathNames(rootId, fetched));
        return new CompartmentListing(entries, capReached);
    }

    /**
     * Names each active compartment by its path from the root. A compartment whose parent chain
     * does not reach the root is named {@code /<name>}.
     */
    static List<OciResource> pathNames(String rootId, List<CompartmentSummary> compartments) {
        Map<String, CompartmentSummary> active = new LinkedHashMap<>();
        for (CompartmentSummary compartment : compartments) {
            if (compartment.active() && compartment.id() != null) {
                active.put(compartment.id(), compartment);
            }
        }

        List<OciResource> named = new ArrayList<>();
        for (CompartmentSummary compartment : active.values()) {
            named.add(new OciResource(pathName(rootId, compartment, active), compartment.id()));
        }
        named.sort(Comparator.comparing(OciResource::name));
        return named;
    }

    private static String pathName(String rootId, CompartmentSummary compartment, Map<String, CompartmentSummary> active) {
        StringBuilder path = new StringBuilder("/").append(compartment.name());
        Set<String> visited = new HashSet<>();
        visited.add(compartment.id());
        String parentId = compartment.parentId();
        while (parentId != null && !parentId.equals(rootId)) {
            CompartmentSummary parent = active.get(parentId);
            if (parent == null || !visited.add(parentId)) {
                return "/" + compartment.name();
            }
            path.insert(0, parent.name()).insert(0, "/");
            parentId = parent.parentId();
        }
        return parentId == null ? "/" + compartment.name() : path.toString();
    }

    private static RawResultSet compartmentTable(CompartmentListing listing) {
        List<List<String>> rows = listing.compartments().stream()
                .map(entry -> List.of(entry.name(), entry.ocid()))
                .toList();
        return RawResultSet.ofTable(List.of("name", "compartmentID"), rows, listing.pageCapReached());
    }

    public List<String> regions(ResolvedTenancy tenancy, String region, QueryContext context) {
        List<String> regions = new ArrayList<>(remote(context, "ListRegions",
                params("region", region),
                () -> tenancy.connector().listRegions(region)));
        regions.sort(Comparator.naturalOrder());
        return regions;
    }

    /**
     * READY region subscriptions of the tenancy, sorted; {@value #ALL_SUBSCRIBED_REGIONS} is
     * appended when there is more than one.
     */
    public List<String> subscribedRegions(ResolvedTenancy tenancy, QueryContext context) {
        String tenancyOcid = tenancy.tenancyOcid();
        List<String> regions = new ArrayList<>(remote(context, "ListRegionSubscriptions",
                params("tenancyId", tenancyOcid),
                () -> tenancy.connector().listSubscribedRegions("", tenancyOcid)));
        regions.sort(Comparator.naturalOrder());
        if (regions.size() > 1) {
            regions.add(ALL_SUBSCRIBED_REGIONS);
        }
        return regions;
    }

    public RawResultSet searchLogs(ResolvedTenancy tenancy, QueryRequest request, QueryContext context) {
        TimeRange range = effectiveRange(request.timeRange());
        SearchPage page = searchPage(tenancy, request.region(), request.searchQuery(),
                range.from(), range.to(), options.searchPageLimit(), context);
        if (page.hasNextPage()) {
            LOGGER.warnv("[QUERY] requestId={0} refId={1} la búsqueda devolvió más de una página, solo se usa la primera ({2} registros)",
                    context.requestId(), request.refId(), page.results().size());
        }
        return RawResultSet.ofRecords(page.results(), SearchQueryShape.of(request.searchQuery()), page.hasNextPage());
    }

    /**
     * The requested range, or the last {@value #DEFAULT_RANGE_MINUTES} minutes when none was
     * given.
     */
    public TimeRange effectiveRange(TimeRange requested) {
        if (requested != null) {
            return requested;
        }
        Instant now = clock.instant();
        return new TimeRange(now.minus(Duration.ofMinutes(DEFAULT_RANGE_MINUTES)).toEpochMilli(), now.toEpochMilli());
    }

    /**
     * Distinct values of {@code field} in one page of search results, in first-seen order. Log
     * records contribute {@code logContent.data.<field>}; aggregated rows contribute their first
     * column that is neither the timestamp nor the count.
     */
    public List<String> fieldValues(ResolvedTenancy tenancy,
                                    String region,
                                    String searchQuery,
                                    String field,
                                    Instant from,
                                    Instant to,
                                    QueryContext context) {
        Instant end = to == null ? clock.instant() : to;
        Instant start = from == null ? end.minus(Duration.ofMinutes(DEFAULT_RANGE_MINUTES)) : from;
        SearchPage page = searchPage(tenancy, region, searchQuery, start, end, options.searchPageLimit(), context);

        Set<String> values = new LinkedHashSet<>();
        for (JsonNode record : page.results()) {
            JsonNode value = record.has("logContent")
                    ? record.path("logContent").path("data").path(field == null ? "" : field)
                    : firstDimension(record);
            if (value != null && !value.isMissingNode() && !value.isNull()) {
                values.add(value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return List.copyOf(values);
    }

    private static JsonNode firstDimension(JsonNode record) {
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!SearchQueryShape.DEFAULT_TIMESTAMP_FIELD.equals(entry.getKey()) && !"count".equals(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Checks the tenancy with a light call suited to the environment. Any non-2xx answer or
     * transport error is a {@link ConnectivityException}.
     */
    public HealthResult checkHealth(ResolvedTenancy tenancy, String environment, QueryContext context) {
        String tenancyOcid = tenancy.tenancyOcid();
        int status;
        try {
            if (DatasourceSettings.ENVIRONMENT_LOCAL.equals(environment)) {
                Instant now = clock.instant();
                status = searchPage(tenancy, "", "search \"" + tenancyOcid + "\" | sort by datetime desc",
                        now.minus(options.healthWindow()), now, HEALTH_SEARCH_LIMIT, context).status();
            } else if (tenancyOcid.isBlank()) {
                regions(tenancy, "", context);
                status = 200;
            } else {
                status = remote(context, "ListLogGroups",
                        params("compartmentId", tenancyOcid),
                        () -> tenancy.connector().listLogGroups("", tenancyOcid, 1));
            }
        } catch (RemoteCallException e) {
            int remoteStatus = e.getCause() instanceof RemoteServiceException remote ? remote.status() : 0;
            String body = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
            throw new ConnectivityException("health check failed for tenancy " + tenancy.key(), remoteStatus, body, e);
        }
        if (status < 200 || status > 299) {
            throw new ConnectivityException("health check failed for tenancy " + tenancy.key()
                    + " with status " + status, status, "");
        }
        return HealthResult.ok();
    }

    private SearchPage searchPage(ResolvedTenancy tenancy,
                                  String region,
                                  String query,
                                  Instant from,
                                  Instant to,
                                  int limit,
                                  QueryContext context) {
        context.checkCancelled("SearchLogs");
        LogSearch search = new LogSearch(query == null ? "" : query, from, to, limit, null);
        return remote(context, "SearchLogs",
                params("region", region, "query", search.query(), "from", from.toString(), "to", to.toString()),
                () -> tenancy.connector().searchLogs(region, search));
    }

    private <T> T remote(QueryContext context, String operation, Map<String, String> parameters, Supplier<T> call) {
        Instant start = clock.instant();
        LOGGER.infov("[COMM-START] requestId={0} target={1} params={2}", context.requestId(), operation, parameters);
        try {
            T result = call.get();
            LOGGER.infov("[COMM-END] requestId={0} target={1} durationMs={2}",
                    context.requestId(), operation, Duration.between(start, clock.instant()).toMillis());
            return result;
        } catch (RequestCancelledException | RemoteCallException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s params=%s", context.requestId(), operation, parameters);
            throw new RemoteCallException(operation, parameters, e);
        }
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            parameters.put(keyValues[i], keyValues[i + 1]);
        }
        return parameters;
    }
}
