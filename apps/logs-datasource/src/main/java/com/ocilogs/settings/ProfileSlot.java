package com.ocilogs.settings;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Names of the configuration fields that make up one profile slot.
 */
public record ProfileSlot(
        int index,
        String profileField,
        String tenancyField,
        String regionField,
        String userField,
        String fingerprintField,
        String privateKeyField,
        String passphraseField
) {
    public static final int MAX_SLOTS = 6;

    public static final List<String> FIELD_NAMES = List.of(
            "profile", "tenancy", "region", "user", "fingerprint", "privkey", "privkeypass");

    /**
     * Slots 0..5 in the order they are walked.
     */
    public static final List<ProfileSlot> SLOTS = IntStream.range(0, MAX_SLOTS)
            .mapToObj(ProfileSlot::of)
            .toList();

    public static ProfileSlot of(int index) {
        return new ProfileSlot(
                index,
                "profile" + index,
                "tenancy" + index,
                "region" + index,
                "user" + index,
                "fingerprint" + index,
                "privkey" + index,
                "privkeypass" + index);
    }
}
