package com.ocilogs.oci;

import com.ocilogs.settings.DatasourceSettings;
import com.ocilogs.settings.TenancyProfile;
import com.ocilogs.settings.TenancyProfileParser;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Resolved tenancies of one datasource instance, keyed by tenancy access key.
 *
 * <p>Built once when the instance is created and read-only afterwards, so lookups can be
 * shared across concurrent requests.
 */
public final class ClientRegistry implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger("DS.ClientRegistry");

    public static final String SINGLE_TENANCY_KEY = "DEFAULT/";

    private final boolean multitenancy;
    private final Map<String, ResolvedTenancy> tenancies;

    private ClientRegistry(boolean multitenancy, Map<String, ResolvedTenancy> tenancies) {
        this.multitenancy = multitenancy;
        this.tenancies = Collections.unmodifiableMap(tenancies);
    }

    /**
     * Builds the tenancies described by the settings. Either every tenancy is resolved or the
     * call fails and the connectors built so far are closed.
     */
    public static ClientRegistry resolve(String environment,
                                         String tenancyMode,
                                         DatasourceSettings settings,
                                         TenancyProfileParser parser,
                                         TenancyConnectorFactory factory) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(factory, "factory");
        boolean multitenancy = DatasourceSettings.MODE_MULTITENANCY.equals(tenancyMode);
        String env = environment == null ? "" : environment;

        switch (env) {
            case DatasourceSettings.ENVIRONMENT_LOCAL:
                LOGGER.debug("[INIT] configurando con user principals");
                return new ClientRegistry(multitenancy, resolveProfiles(multitenancy, parser.parse(settings), factory));
            case DatasourceSettings.ENVIRONMENT_INSTANCE:
                LOGGER.debug("[INIT] configurando con instance principal");
                return new ClientRegistry(false, resolveInstance(settings, factory));
            default:
                throw new UnknownEnvironmentException(env);
        }
    }

    private static Map<String, ResolvedTenancy> resolveProfiles(boolean multitenancy,
                                                                List<TenancyProfile> profiles,
                                                                TenancyConnectorFactory factory) {
        List<TenancyProfile> selected = new ArrayList<>();
        for (TenancyProfile profile : profiles) {
            if (!multitenancy && !selected.isEmpty()) {
                LOGGER.warnv("[INIT] modo single tenancy, se omite el perfil adicional {0}", profile.profileKey());
                continue;
            }
            PemKeys.requireBlock(profile.profileKey(), profile.privateKeyPem());
            selected.add(profile);
        }

        Map<String, ResolvedTenancy> resolved = new LinkedHashMap<>();
        try {
            for (TenancyProfile profile : selected) {
                TenancyConnector connector = build(profile.profileKey(), () -> factory.forProfile(profile));
                ResolvedTenancy tenancy;
                try {
                    String tenancyOcid = connector.tenancyOcid();
                    if (tenancyOcid == null || tenancyOcid.isBlank()) {
                        throw new ClientConstructionException("error with TenancyOCID for profile " + profile.profileKey());
                    }
                    String key = multitenancy ? profile.profileKey() + "/" + tenancyOcid : SINGLE_TENANCY_KEY;
                    tenancy = new ResolvedTenancy(key, profile.profileKey(), tenancyOcid, connector);
                } catch (RuntimeException e) {
                    closeQuietly(connector);
                    throw e;
                }
                resolved.put(tenancy.key(), tenancy);
                LOGGER.infov("[INIT] tenancy lista. key={0} region={1}", tenancy.key(), connector.defaultRegion());
            }
        } catch (RuntimeException e) {
            resolved.values().forEach(tenancy -> closeQuietly(tenancy.connector()));
            throw e;
        }
        return resolved;
    }

    private static Map<String, ResolvedTenancy> resolveInstance(DatasourceSettings settings,
                                                                TenancyConnectorFactory factory) {
        TenancyConnector connector = build(SINGLE_TENANCY_KEY, () -> factory.forInstancePrincipal(settings));
        String tenancyOcid = settings.crossTenancy().orElse(connector.tenancyOcid());
        Map<String, ResolvedTenancy> resolved = new LinkedHashMap<>();
        resolved.put(SINGLE_TENANCY_KEY, new ResolvedTenancy(SINGLE_TENANCY_KEY, SINGLE_TENANCY_KEY, tenancyOcid, connector));
        LOGGER.infov("[INIT] tenancy lista. key={0} region={1}", SINGLE_TENANCY_KEY, connector.defaultRegion());
        return resolved;
    }

    private static TenancyConnector build(String profileKey, Supplier<TenancyConnector> builder) {
        try {
            TenancyConnector connector = builder.get();
            if (connector == null) {
                throw new ClientConstructionException("no client built for profile " + profileKey);
            }
            return connector;
        } catch (ClientConstructionException | InvalidCredentialException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ClientConstructionException("error creating clients for profile " + profileKey, e);
        }
    }

    /**
     * Access key for a request: the requested tenancy in multitenancy mode, the single tenancy
     * key otherwise.
     */
    public String accessKey(String requestedTenancy) {
        return multitenancy ? requestedTenancy : SINGLE_TENANCY_KEY;
    }

    public ResolvedTenancy lookup(String key) {
        ResolvedTenancy tenancy = key == null ? null : tenancies.get(key);
        if (tenancy == null) {
            LOGGER.errorv("[LOOKUP] tenancy key inválida: {0}", key);
            throw new UnknownTenancyException(key);
        }
        return tenancy;
    }

    public Map<String, ResolvedTenancy> tenancies() {
        return tenancies;
    }

    public boolean multitenancy() {
        return multitenancy;
    }

    @Override
    public void close() {
        tenancies.values().forEach(tenancy -> closeQuietly(tenancy.connector()));
    }

    private static void closeQuietly(TenancyConnector connector) {
        try {
            connector.close();
        } catch (RuntimeException e) {
            LOGGER.warnf(e, "[CLOSE] no se pudo cerrar el conector %s", connector.getClass().getSimpleName());
        }
    }
}
