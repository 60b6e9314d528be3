package com.ocilogs.oci;

import com.fasterxml.jackson.databind.JsonNode;
import com.ocilogs.model.CompartmentPage;
import com.ocilogs.model.LogSearch;
import com.ocilogs.model.SearchPage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * In-memory connector for tests. Each operation answers from the configured data and records
 * its calls.
 */
public class StubTenancyConnector implements TenancyConnector {

    public final String tenancyOcid;
    public final String region;

    public Function<String, CompartmentPage> compartmentPages = token -> new CompartmentPage(List.of(), null);
    public String tenancyName = "acme";
    public List<String> regions = List.of();
    public List<String> subscribedRegions = List.of();
    public List<JsonNode> searchResults = List.of();
    public String searchNextPage;
    public int searchStatus = 200;
    public int logGroupsStatus = 200;
    public RuntimeException failure;

    public final List<String> compartmentTokens = new ArrayList<>();
    public final List<LogSearch> searches = new ArrayList<>();
    public final List<String> calls = new ArrayList<>();
    public final List<String> callRegions = new ArrayList<>();
    public boolean closed;

    public StubTenancyConnector(String tenancyOcid) {
        this(tenancyOcid, "us-phoenix-1");
    }

    public StubTenancyConnector(String tenancyOcid, String region) {
        this.tenancyOcid = tenancyOcid;
        this.region = region;
    }

    @Override
    public String tenancyOcid() {
        return tenancyOcid;
    }

    @Override
    public String defaultRegion() {
        return region;
    }

    @Override
    public CompartmentPage listCompartments(String region, String compartmentId, String pageToken) {
        record("ListCompartments", region);
        compartmentTokens.add(pageToken);
        return compartmentPages.apply(pageToken);
    }

    @Override
    public String getTenancyName(String region, String tenancyOcid) {
        record("GetTenancy", region);
        return tenancyName;
    }

    @Override
    public List<String> listRegions(String region) {
        record("ListRegions", region);
        return regions;
    }

    @Override
    public List<String> listSubscribedRegions(String region, String tenancyOcid) {
        record("ListRegionSubscriptions", region);
        return subscribedRegions;
    }

    @Override
    public SearchPage searchLogs(String region, LogSearch search) {
        record("SearchLogs", region);
        searches.add(search);
        return new SearchPage(searchResults, searchNextPage, searchStatus);
    }

    @Override
    public int listLogGroups(String region, String compartmentId, int limit) {
        record("ListLogGroups", region);
        return logGroupsStatus;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void record(String operation, String region) {
        calls.add(operation);
        callRegions.add(operation + "@" + region);
        if (failure != null) {
            throw failure;
        }
    }
}
