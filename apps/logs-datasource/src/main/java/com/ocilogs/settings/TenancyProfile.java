package com.ocilogs.settings;

import java.util.Objects;
import java.util.Optional;

/**
 * Credentials of one tenancy as configured in a profile slot.
 */
public record TenancyProfile(
        int slot,
        String profileKey,
        String tenancyOcid,
        String userOcid,
        String region,
        String fingerprint,
        String privateKeyPem,
        Optional<String> privateKeyPassphrase
) {
    public TenancyProfile {
        Objects.requireNonNull(profileKey, "profileKey");
        privateKeyPassphrase = privateKeyPassphrase == null ? Optional.empty() : privateKeyPassphrase;
    }

    @Override
    public String toString() {
        // key material stays out of logs
        return "TenancyProfile[slot=" + slot
                + ", profileKey=" + profileKey
                + ", tenancyOcid=" + tenancyOcid
                + ", userOcid=" + userOcid
                + ", region=" + region
                + ", fingerprint=" + fingerprint + "]";
    }
}
