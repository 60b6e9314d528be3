package com.ocilogs.datasource;

import com.ocilogs.cache.ResultCache;
import com.ocilogs.frame.ResultFramer;
import com.ocilogs.oci.ClientRegistry;
import com.ocilogs.oci.TenancyConnectorFactory;
import com.ocilogs.query.QueryExecutor;
import com.ocilogs.query.QueryOptions;
import com.ocilogs.settings.DatasourceSettings;
import com.ocilogs.settings.TenancyProfileParser;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Datasource instances by uid. Building an instance resolves all of its tenancies up front;
 * replacing or removing one closes its clients.
 */
@ApplicationScoped
public class DatasourceInstances {

    private static final Logger LOGGER = Logger.getLogger("DS.DatasourceInstances");

    @Inject
    TenancyConnectorFactory connectorFactory;

    @Inject
    TenancyProfileParser parser;

    @Inject
    ResultFramer framer;

    @ConfigProperty(name = "logsearch.cache.max-cost", defaultValue = "1073741824")
    long cacheMaxCost;

    @ConfigProperty(name = "logsearch.cache.refresh-interval", defaultValue = "PT1M")
    Duration refreshInterval;

    @ConfigProperty(name = "logsearch.search.page-limit", defaultValue = "500")
    int searchPageLimit;

    @ConfigProperty(name = "logsearch.compartments.max-pages", defaultValue = "20")
    int compartmentMaxPages;

    @ConfigProperty(name = "logsearch.health.window", defaultValue = "PT30M")
    Duration healthWindow;

    Clock clock = Clock.systemUTC();

    private final Map<String, LogsDatasource> instances = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] DatasourceInstances listo. factory={0}, cacheMaxCost={1}, refresh={2}, pageLimit={3}, maxPages={4}",
                connectorFactory != null ? connectorFactory.getClass().getSimpleName() : "<null>",
                cacheMaxCost,
                refreshInterval,
                searchPageLimit,
                compartmentMaxPages);
    }

    /**
     * Builds the instance and makes it current for {@code uid}. A failed build leaves the
     * previous instance in place.
     */
    public LogsDatasource configure(String uid, DatasourceSettings settings) {
        ClientRegistry registry = ClientRegistry.resolve(
                settings.environment(), settings.tenancyMode(), settings, parser, connectorFactory);
        QueryExecutor executor = new QueryExecutor(
                new ResultCache(cacheMaxCost),
                new QueryOptions(refreshInterval, searchPageLimit, compartmentMaxPages, healthWindow),
                clock);
        LogsDatasource datasource = new LogsDatasource(uid, settings, registry, executor, framer);
        LogsDatasource previous = instances.put(uid, datasource);
        if (previous != null) {
            LOGGER.infov("[INIT] datasource {0} reemplazado", uid);
            previous.close();
        }
        LOGGER.infov("[INIT] datasource {0} listo. environment={1} tenancies={2}",
                uid, settings.environment(), registry.tenancies().keySet());
        return datasource;
    }

    public LogsDatasource get(String uid) {
        LogsDatasource datasource = instances.get(uid);
        if (datasource == null) {
            throw new UnknownDatasourceException(uid);
        }
        return datasource;
    }

    public void remove(String uid) {
        LogsDatasource datasource = instances.remove(uid);
        if (datasource == null) {
            throw new UnknownDatasourceException(uid);
        }
        datasource.close();
        LOGGER.infov("[CLOSE] datasource {0} eliminado", uid);
    }

    @PreDestroy
    void close() {
        instances.values().forEach(LogsDatasource::close);
        instances.clear();
    }
}
