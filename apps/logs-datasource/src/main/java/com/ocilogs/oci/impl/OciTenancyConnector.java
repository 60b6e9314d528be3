package com.ocilogs.oci.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.ocilogs.model.CompartmentPage;
import com.ocilogs.model.CompartmentSummary;
import com.ocilogs.model.LogSearch;
import com.ocilogs.model.SearchPage;
import com.ocilogs.oci.RemoteServiceException;
import com.ocilogs.oci.TenancyConnector;
import com.oracle.bmc.Region;
import com.oracle.bmc.auth.BasicAuthenticationDetailsProvider;
import com.oracle.bmc.identity.IdentityClient;
import com.oracle.bmc.identity.model.Compartment;
import com.oracle.bmc.identity.model.RegionSubscription;
import com.oracle.bmc.identity.requests.GetTenancyRequest;
import com.oracle.bmc.identity.requests.ListCompartmentsRequest;
import com.oracle.bmc.identity.requests.ListRegionSubscriptionsRequest;
import com.oracle.bmc.identity.requests.ListRegionsRequest;
import com.oracle.bmc.identity.responses.ListCompartmentsResponse;
import com.oracle.bmc.logging.LoggingManagementClient;
import com.oracle.bmc.logging.requests.ListLogGroupsRequest;
import com.oracle.bmc.loggingsearch.LogSearchClient;
import com.oracle.bmc.loggingsearch.model.SearchLogsDetails;
import com.oracle.bmc.loggingsearch.model.SearchResponse;
import com.oracle.bmc.loggingsearch.model.SearchResult;
import com.oracle.bmc.loggingsearch.requests.SearchLogsRequest;
import com.oracle.bmc.loggingsearch.responses.SearchLogsResponse;
import com.oracle.bmc.model.BmcException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TenancyConnector} backed by the OCI Java SDK.
 *
 * <p>SDK clients carry their target region as mutable state. Each region therefore gets its
 * own client set, created on first use with the region fixed at creation; no client is
 * re-pointed to another region afterwards.
 */
public class OciTenancyConnector implements TenancyConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(OciTenancyConnector.class);

    private final BasicAuthenticationDetailsProvider provider;
    private final String tenancyOcid;
    private final Region homeRegion;
    private final ObjectMapper mapper;
    private final Map<String, RegionalClients> clientsByRegion = new ConcurrentHashMap<>();

    public OciTenancyConnector(BasicAuthenticationDetailsProvider provider,
                               String tenancyOcid,
                               Region homeRegion,
                               ObjectMapper mapper) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.homeRegion = Objects.requireNonNull(homeRegion, "homeRegion");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.tenancyOcid = tenancyOcid == null ? "" : tenancyOcid;
        // home region clients are built eagerly so construction errors surface at startup
        clients(null);
    }

    @Override
    public String tenancyOcid() {
        return tenancyOcid;
    }

    @Override
    public String defaultRegion() {
        return homeRegion.getRegionId();
    }

    @Override
    public CompartmentPage listCompartments(String region, String compartmentId, String pageToken) {
        ListCompartmentsRequest request = ListCompartmentsRequest.builder()
                .compartmentId(compartmentId)
                .compartmentIdInSubtree(Boolean.TRUE)
                .accessLevel(ListCompartmentsRequest.AccessLevel.Any)
                .page(pageToken)
                .build();
        ListCompartmentsResponse response = call("ListCompartments",
                () -> clients(region).identity().listCompartments(request));
        List<CompartmentSummary> items = Optional.ofNullable(response.getItems())
                .orElse(List.of())
                .stream()
                .map(compartment -> new CompartmentSummary(
                        compartment.getId(),
                        compartment.getName(),
                        compartment.getCompartmentId(),
                        compartment.getLifecycleState() == Compartment.LifecycleState.Active))
                .toList();
        return new CompartmentPage(items, response.getOpcNextPage());
    }

    @Override
    public String getTenancyName(String region, String tenancyOcid) {
        GetTenancyRequest request = GetTenancyRequest.builder().tenancyId(tenancyOcid).build();
        return call("GetTenancy", () -> clients(region).identity().getTenancy(request))
                .getTenancy()
                .getName();
    }

    @Override
    public List<String> listRegions(String region) {
        return Optional.ofNullable(call("ListRegions",
                        () -> clients(region).identity().listRegions(ListRegionsRequest.builder().build()))
                        .getItems())
                .orElse(List.of())
                .stream()
                .map(com.oracle.bmc.identity.model.Region::getName)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public List<String> listSubscribedRegions(String region, String tenancyOcid) {
        ListRegionSubscriptionsRequest request = ListRegionSubscriptionsRequest.builder()
                .tenancyId(tenancyOcid)
                .build();
        return Optional.ofNullable(call("ListRegionSubscriptions",
                        () -> clients(region).identity().listRegionSubscriptions(request))
                        .getItems())
                .orElse(List.of())
                .stream()
                .filter(subscription -> subscription.getStatus() == RegionSubscription.Status.Ready)
                .map(RegionSubscription::getRegionName)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public SearchPage searchLogs(String region, LogSearch search) {
        SearchLogsDetails details = SearchLogsDetails.builder()
                .searchQuery(search.query())
                .timeStart(Date.from(search.from()))
                .timeEnd(Date.from(search.to()))
                .isReturnFieldInfo(Boolean.FALSE)
                .build();
        SearchLogsRequest request = SearchLogsRequest.builder()
                .searchLogsDetails(details)
                .limit(search.limit())
                .page(search.pageToken())
                .build();
        SearchLogsResponse response = call("SearchLogs", () -> clients(region).search().searchLogs(request));
        List<SearchResult> results = Optional.ofNullable(response.getSearchResponse())
                .map(SearchResponse::getResults)
                .orElse(List.of());
        List<JsonNode> records = results.stream()
                .map(result -> toJson(result.getData()))
                .toList();
        return new SearchPage(records, response.getOpcNextPage(), response.get__httpStatusCode__());
    }

    @Override
    public int listLogGroups(String region, String compartmentId, int limit) {
        ListLogGroupsRequest request = ListLogGroupsRequest.builder()
                .compartmentId(compartmentId)
                .isCompartmentIdInSubtree(Boolean.TRUE)
                .limit(limit)
                .build();
        return call("ListLogGroups", () -> clients(region).management().listLogGroups(request))
                .get__httpStatusCode__();
    }

    @Override
    public void close() {
        clientsByRegion.values().forEach(RegionalClients::close);
        clientsByRegion.clear();
    }

    private RegionalClients clients(String region) {
        String regionId = region == null || region.isBlank() ? homeRegion.getRegionId() : region;
        return clientsByRegion.computeIfAbsent(regionId, id -> RegionalClients.create(provider, Region.fromRegionCodeOrId(id)));
    }

    private JsonNode toJson(Object data) {
        if (data == null) {
            return NullNode.getInstance();
        }
        JsonNode node = mapper.valueToTree(data);
        return node == null ? NullNode.getInstance() : node;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (BmcException e) {
            LOGGER.debug("{} failed with status {} ({}): {}", operation, e.getStatusCode(), e.getServiceCode(), e.getMessage());
            throw new RemoteServiceException(e.getStatusCode(), e.getServiceCode(), e.getMessage(), e);
        }
    }

    record RegionalClients(
            LogSearchClient search,
            LoggingManagementClient management,
            IdentityClient identity
    ) {
        static RegionalClients create(BasicAuthenticationDetailsProvider provider, Region region) {
            RegionalClients clients = create(
                    () -> {
                        LogSearchClient search = LogSearchClient.builder().build(provider);
                        search.setRegion(region);
                        return search;
                    },
                    () -> {
                        LoggingManagementClient management = LoggingManagementClient.builder().build(provider);
                        management.setRegion(region);
                        return management;
                    },
                    () -> {
                        IdentityClient identity = IdentityClient.builder().build(provider);
                        identity.setRegion(region);
                        return identity;
                    });
            LOGGER.debug("Created clients for region {}", region.getRegionId());
            return clients;
        }

        /**
         * Builds the three clients in order. When one fails, those already built are closed.
         */
        static RegionalClients create(Supplier<LogSearchClient> searchBuilder,
                                      Supplier<LoggingManagementClient> managementBuilder,
                                      Supplier<IdentityClient> identityBuilder) {
            LogSearchClient search = searchBuilder.get();
            LoggingManagementClient management;
            try {
                management = managementBuilder.get();
            } catch (RuntimeException e) {
                closeQuietly(search);
                throw e;
            }
            try {
                return new RegionalClients(search, management, identityBuilder.get());
            } catch (RuntimeException e) {
                closeQuietly(search);
                closeQuietly(management);
                throw e;
            }
        }

        void close() {
            closeQuietly(search);
            closeQuietly(management);
            closeQuietly(identity);
        }

        private static void closeQuietly(AutoCloseable client) {
            try {
                client.close();
            } catch (Exception e) {
                LOGGER.warn("Failed to close client {}: {}", client.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
