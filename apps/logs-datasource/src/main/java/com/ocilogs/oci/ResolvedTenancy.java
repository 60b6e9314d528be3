package com.ocilogs.oci;

import java.util.Objects;

/**
 * A tenancy ready to be queried: its registry key, its OCID and the connector holding its
 * credential provider and clients.
 */
public record ResolvedTenancy(
        String key,
        String profileKey,
        String tenancyOcid,
        TenancyConnector connector
) {
    public ResolvedTenancy {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(connector, "connector");
        tenancyOcid = tenancyOcid == null ? "" : tenancyOcid;
    }
}
