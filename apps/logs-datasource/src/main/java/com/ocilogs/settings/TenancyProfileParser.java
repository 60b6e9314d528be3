package com.ocilogs.settings;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Decodes the indexed profile slots of a datasource configuration into tenancy profiles.
 *
 * <p>The secured blob carries the credentials ({@code profileN}, {@code tenancyN}, {@code userN},
 * {@code fingerprintN}, {@code privkeyN}, {@code privkeypassN}); the plain blob carries
 * {@code regionN} and {@code profileN}, which win over the secured values when present.
 * Slots are walked from 0 to 5 and the first slot with an empty profile name ends the walk:
 * later slots are never read, even when populated.
 */
@ApplicationScoped
public class TenancyProfileParser {

    private static final Logger LOGGER = Logger.getLogger("DS.TenancyProfileParser");

    private static final List<String> NAMES_LONGEST_FIRST = ProfileSlot.FIELD_NAMES.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    public List<TenancyProfile> parse(DatasourceSettings settings) {
        Map<String, String> merged = merge(settings);

        List<TenancyProfile> profiles = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        for (ProfileSlot slot : ProfileSlot.SLOTS) {
            String profileKey = merged.getOrDefault(slot.profileField(), "").trim();
            if (profileKey.isEmpty()) {
                LOGGER.debugv("[PARSE] slot {0} sin perfil, fin de la lectura ({1} perfiles)", slot.index(), profiles.size());
                break;
            }
            if (!keys.add(profileKey)) {
                throw new ConfigException("duplicate profile name '" + profileKey + "' in slot " + slot.index());
            }
            profiles.add(new TenancyProfile(
                    slot.index(),
                    profileKey,
                    merged.getOrDefault(slot.tenancyField(), ""),
                    merged.getOrDefault(slot.userField(), ""),
                    merged.getOrDefault(slot.regionField(), ""),
                    merged.getOrDefault(slot.fingerprintField(), ""),
                    merged.getOrDefault(slot.privateKeyField(), ""),
                    Optional.ofNullable(merged.get(slot.passphraseField())).filter(value -> !value.isEmpty())));
        }
        return List.copyOf(profiles);
    }

    private Map<String, String> merge(DatasourceSettings settings) {
        Map<String, String> merged = new HashMap<>();
        settings.secureJsonData().forEach((key, value) -> merged.put(canonicalKey(key), value));

        for (ProfileSlot slot : ProfileSlot.SLOTS) {
            settings.plain(slot.regionField()).ifPresent(value -> merged.put(slot.regionField(), value));
            settings.plain(slot.profileField()).ifPresent(value -> merged.put(slot.profileField(), value));
        }
        return merged;
    }

    /**
     * Splits a secured key into field name and slot index, returning the {@code <name><index>} form.
     */
    static String canonicalKey(String key) {
        String name = NAMES_LONGEST_FIRST.stream()
                .filter(key::startsWith)
                .findFirst()
                .orElseThrow(() -> new ConfigException("malformed setting name '" + key + "'"));
        String suffix = key.substring(name.length());
        if (suffix.startsWith("_")) {
            suffix = suffix.substring(1);
        }
        if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
            throw new ConfigException("setting '" + key + "' has no numeric slot index");
        }
        int index;
        try {
            index = Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            throw new ConfigException("setting '" + key + "' has no numeric slot index", e);
        }
        if (index >= ProfileSlot.MAX_SLOTS) {
            throw new ConfigException("setting '" + key + "' refers to slot " + index
                    + ", only " + ProfileSlot.MAX_SLOTS + " slots are supported");
        }
        return name + index;
    }
}
