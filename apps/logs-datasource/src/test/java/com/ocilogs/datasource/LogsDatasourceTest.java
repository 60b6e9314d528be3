package com.ocilogs.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocilogs.cache.MutableClock;
import com.ocilogs.cache.ResultCache;
import com.ocilogs.frame.ResultFramer;
import com.ocilogs.frame.TypedField;
import com.ocilogs.oci.ClientRegistry;
import com.ocilogs.oci.RemoteServiceException;
import com.ocilogs.oci.StubTenancyConnector;
import com.ocilogs.oci.TenancyConnector;
import com.ocilogs.oci.TenancyConnectorFactory;
import com.ocilogs.query.HealthResult;
import com.ocilogs.query.QueryContext;
import com.ocilogs.query.QueryExecutor;
import com.ocilogs.query.QueryOptions;
import com.ocilogs.query.QueryRequest;
import com.ocilogs.query.TimeRange;
import com.ocilogs.settings.DatasourceSettings;
import com.ocilogs.settings.SettingsFixtures;
import com.ocilogs.settings.TenancyProfile;
import com.ocilogs.settings.TenancyProfileParser;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogsDatasourceTest {

    final ObjectMapper mapper = new ObjectMapper();
    final Map<String, StubTenancyConnector> connectors = new HashMap<>();

    MutableClock clock;
    LogsDatasource datasource;

    @BeforeEach
    void setUp() {
        DatasourceSettings settings = SettingsFixtures.local("multitenancy")
                .profile(0, "alpha")
                .profile(1, "beta")
                .build();
        TenancyConnectorFactory factory = new TenancyConnectorFactory() {
            @Override
            public TenancyConnector forProfile(TenancyProfile profile) {
                StubTenancyConnector connector = new StubTenancyConnector(profile.tenancyOcid());
                connectors.put(profile.profileKey(), connector);
                return connector;
            }

            @Override
            public TenancyConnector forInstancePrincipal(DatasourceSettings ignored) {
                throw new UnsupportedOperationException();
            }
        };
        ClientRegistry registry = ClientRegistry.resolve(settings.environment(), settings.tenancyMode(), settings,
                new TenancyProfileParser(), factory);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        QueryExecutor executor = new QueryExecutor(new ResultCache(1_000_000, Runnable::run, clock), QueryOptions.defaults(), clock);
        datasource = new LogsDatasource("ds-1", settings, registry, executor, new ResultFramer());
    }

    @Test
    void failingQueryDoesNotAbortItsSiblings() throws Exception {
        connectors.get("alpha").searchResults = List.of(mapper.readTree(
                "{\"logContent\":{\"time\":\"1970-01-01T00:01:00Z\",\"message\":\"up\"}}"));
        connectors.get("beta").failure = new RemoteServiceException(503, "ServiceUnavailable", "try later", null);

        List<QueryResult> results = datasource.query(List.of(
                search("A", "alpha/ocid1.tenancy.oc1..alpha"),
                search("B", "beta/ocid1.tenancy.oc1..beta"),
                search("C", "gamma/ocid1.tenancy.oc1..gamma")), new QueryContext("req-1"));

        assertEquals(3, results.size());
        QueryResult first = results.get(0);
        assertFalse(first.failed());
        TypedField message = first.frame().field("message").orElseThrow();
        assertEquals("up", message.value(0));

        assertTrue(results.get(1).failed());
        assertTrue(results.get(1).error().contains("SearchLogs"));
        assertNull(results.get(1).frame());

        assertTrue(results.get(2).error().contains("Invalid tenancy key"));
    }

    @Test
    void searchWithoutTimeRangeFramesTheLastFiveMinutes() throws Exception {
        connectors.get("alpha").searchResults = List.of(mapper.readTree(
                "{\"logContent\":{\"time\":\"2023-12-31T23:58:00Z\",\"message\":\"late\"}}"));

        List<QueryResult> results = datasource.query(List.of(new QueryRequest(null, "multitenancy", "searchLogs",
                "us-phoenix-1", null, "alpha/ocid1.tenancy.oc1..alpha", "search \"ns\"", 5, "1", "A", null)),
                new QueryContext("req-4"));

        QueryResult result = results.get(0);
        assertFalse(result.failed(), () -> result.error());
        assertEquals(Instant.parse("2023-12-31T23:55:00Z"), connectors.get("alpha").searches.get(0).from());
        assertEquals(clock.instant(), connectors.get("alpha").searches.get(0).to());
        TypedField timestamps = result.frame().field(ResultFramer.TIMESTAMP_FIELD).orElseThrow();
        assertEquals(Instant.parse("2023-12-31T23:55:00Z"), timestamps.value(0));
        assertEquals("late", result.frame().field("message").orElseThrow().value(3));
    }

    @Test
    void healthFailsOnFirstUnhealthyTenancy() {
        connectors.get("beta").searchStatus = 500;

        HealthResult result = datasource.checkHealth(new QueryContext("req-2"));

        assertFalse(result.healthy());
        assertTrue(result.message().contains("beta/ocid1.tenancy.oc1..beta"));
    }

    @Test
    void healthyWhenEveryTenancyAnswers() {
        HealthResult result = datasource.checkHealth(new QueryContext("req-3"));

        assertTrue(result.healthy());
        assertEquals("Success", result.message());
        assertEquals(1, connectors.get("alpha").searches.size());
        assertEquals(1, connectors.get("beta").searches.size());
    }

    @Test
    void tenanciesAreListedByKey() {
        assertEquals(List.of("alpha/ocid1.tenancy.oc1..alpha", "beta/ocid1.tenancy.oc1..beta"),
                datasource.tenancies().stream().map(resource -> resource.ocid()).toList());
    }

    @Test
    void closeReleasesConnectors() {
        datasource.close();

        assertTrue(connectors.values().stream().allMatch(connector -> connector.closed));
    }

    private static QueryRequest search(String refId, String tenancy) {
        return new QueryRequest(null, "multitenancy", "searchLogs", "us-phoenix-1", null, tenancy,
                "search \"ns\"", 5, "1", refId, new TimeRange(0, 600_000));
    }
}
