package com.ocilogs.oci.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocilogs.oci.ClientConstructionException;
import com.ocilogs.oci.TenancyConnector;
import com.ocilogs.oci.TenancyConnectorFactory;
import com.ocilogs.settings.DatasourceSettings;
import com.ocilogs.settings.TenancyProfile;
import com.oracle.bmc.Region;
import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.auth.SimpleAuthenticationDetailsProvider;
import com.oracle.bmc.auth.StringPrivateKeySupplier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds OCI SDK connectors, from user principals (API signing keys) or from the identity of
 * the compute instance the service runs on.
 */
@ApplicationScoped
public class OciTenancyConnectorFactory implements TenancyConnectorFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(OciTenancyConnectorFactory.class);

    @Inject
    ObjectMapper mapper;

    @Override
    public TenancyConnector forProfile(TenancyProfile profile) {
        if (profile.region() == null || profile.region().isBlank()) {
            throw new ClientConstructionException("no region configured for profile " + profile.profileKey());
        }
        try {
            Region region = Region.fromRegionCodeOrId(profile.region().trim());
            SimpleAuthenticationDetailsProvider.SimpleAuthenticationDetailsProviderBuilder builder =
                    SimpleAuthenticationDetailsProvider.builder()
                            .tenantId(profile.tenancyOcid())
                            .userId(profile.userOcid())
                            .fingerprint(profile.fingerprint())
                            .privateKeySupplier(new StringPrivateKeySupplier(profile.privateKeyPem()))
                            .region(region);
            profile.privateKeyPassphrase().ifPresent(pass -> builder.passphraseCharacters(pass.toCharArray()));
            SimpleAuthenticationDetailsProvider provider = builder.build();
            LOGGER.debug("Building connector for profile {} in region {}", profile.profileKey(), region.getRegionId());
            return new OciTenancyConnector(provider, provider.getTenantId(), region, mapper);
        } catch (IllegalArgumentException e) {
            throw new ClientConstructionException("error creating clients for profile " + profile.profileKey()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public TenancyConnector forInstancePrincipal(DatasourceSettings settings) {
        InstancePrincipalsAuthenticationDetailsProvider provider =
                InstancePrincipalsAuthenticationDetailsProvider.builder().build();
        Region region = provider.getRegion();
        if (region == null) {
            throw new ClientConstructionException("instance metadata did not report a region");
        }
        String tenancyOcid = settings.crossTenancy().orElse("");
        LOGGER.debug("Building instance principal connector in region {} (target tenancy: {})",
                region.getRegionId(), tenancyOcid.isEmpty() ? "<request>" : tenancyOcid);
        return new OciTenancyConnector(provider, tenancyOcid, region, mapper);
    }
}
