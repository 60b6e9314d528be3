package com.ocilogs.settings;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenancyProfileParserTest {

    TenancyProfileParser parser;

    @BeforeEach
    void setUp() {
        parser = new TenancyProfileParser();
    }

    @Test
    void denselyPopulatedSlotsYieldEveryProfile() {
        DatasourceSettings settings = SettingsFixtures.local("multitenancy")
                .profile(0, "alpha")
                .profile(1, "beta")
                .profile(2, "gamma")
                .build();

        List<TenancyProfile> profiles = parser.parse(settings);

        assertEquals(List.of("alpha", "beta", "gamma"), profiles.stream().map(TenancyProfile::profileKey).toList());
        assertEquals("ocid1.tenancy.oc1..beta", profiles.get(1).tenancyOcid());
        assertEquals("us-ashburn-1", profiles.get(2).region());
        assertEquals(2, profiles.get(2).slot());
    }

    @Test
    void emptyProfileNameEndsTheWalk() {
        DatasourceSettings settings = SettingsFixtures.local("multitenancy")
                .profile(0, "alpha")
                .profile(1, "beta")
                .profile(3, "delta")
                .profile(4, "epsilon")
                .secure("profile2", "")
                .build();

        List<TenancyProfile> profiles = parser.parse(settings);

        assertEquals(List.of("alpha", "beta"), profiles.stream().map(TenancyProfile::profileKey).toList());
    }

    @Test
    void noProfilesYieldsEmptyList() {
        assertTrue(parser.parse(SettingsFixtures.local("single").build()).isEmpty());
    }

    @Test
    void plainRegionAndProfileWinOverSecuredValues() {
        DatasourceSettings settings = SettingsFixtures.local("single")
                .profile(0, "alpha")
                .secure("region0", "eu-frankfurt-1")
                .plain("region0", "ap-tokyo-1")
                .plain("profile0", "renamed")
                .build();

        TenancyProfile profile = parser.parse(settings).get(0);

        assertEquals("ap-tokyo-1", profile.region());
        assertEquals("renamed", profile.profileKey());
    }

    @Test
    void underscoreSeparatedKeysAreAccepted() {
        DatasourceSettings settings = SettingsFixtures.local("single")
                .secure("profile_0", "alpha")
                .secure("tenancy_0", "ocid1.tenancy.oc1..alpha")
                .secure("privkey_0", SettingsFixtures.PEM)
                .secure("privkeypass_0", "secret")
                .build();

        TenancyProfile profile = parser.parse(settings).get(0);

        assertEquals("ocid1.tenancy.oc1..alpha", profile.tenancyOcid());
        assertEquals(SettingsFixtures.PEM, profile.privateKeyPem());
        assertEquals("secret", profile.privateKeyPassphrase().orElseThrow());
    }

    @Test
    void emptyPassphraseIsAbsent() {
        DatasourceSettings settings = SettingsFixtures.local("single").profile(0, "alpha").build();

        assertTrue(parser.parse(settings).get(0).privateKeyPassphrase().isEmpty());
    }

    @Test
    void malformedKeysAreRejected() {
        assertThrows(ConfigException.class, () -> TenancyProfileParser.canonicalKey("bogus0"));
        assertThrows(ConfigException.class, () -> TenancyProfileParser.canonicalKey("profileX"));
        assertThrows(ConfigException.class, () -> TenancyProfileParser.canonicalKey("tenancy"));
        assertThrows(ConfigException.class, () -> TenancyProfileParser.canonicalKey("region6"));
        assertEquals("privkeypass3", TenancyProfileParser.canonicalKey("privkeypass_3"));
        assertEquals("privkey3", TenancyProfileParser.canonicalKey("privkey3"));
    }

    @Test
    void malformedSecuredKeyFailsTheParse() {
        DatasourceSettings settings = SettingsFixtures.local("single")
                .profile(0, "alpha")
                .secure("tenancy_x", "ocid1.tenancy.oc1..zzz")
                .build();

        assertThrows(ConfigException.class, () -> parser.parse(settings));
    }

    @Test
    void duplicateProfileNamesAreRejected() {
        DatasourceSettings settings = SettingsFixtures.local("multitenancy")
                .profile(0, "alpha")
                .profile(1, "alpha")
                .build();

        ConfigException error = assertThrows(ConfigException.class, () -> parser.parse(settings));
        assertTrue(error.getMessage().contains("alpha"));
    }

    @Test
    void settingsAreReadFromHostJson() {
        DatasourceSettings settings = DatasourceSettings.fromJson(
                SettingsFixtures.local("multitenancy").profile(0, "alpha").plain("xtenancy0", "ocid1.tenancy.oc1..x").json());

        assertEquals(DatasourceSettings.ENVIRONMENT_LOCAL, settings.environment());
        assertTrue(settings.multitenancy());
        assertEquals("ocid1.tenancy.oc1..x", settings.crossTenancy().orElseThrow());
        assertEquals(1, parser.parse(settings).size());
    }
}
