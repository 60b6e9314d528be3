package com.ocilogs.settings;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of one datasource instance as handed over by the host: a plain JSON blob and a
 * decrypted secured blob.
 */
public record DatasourceSettings(
        JsonNode jsonData,
        Map<String, String> secureJsonData
) {
    public static final String ENVIRONMENT_LOCAL = "local";
    public static final String ENVIRONMENT_INSTANCE = "OCI Instance";
    public static final String MODE_MULTITENANCY = "multitenancy";

    public DatasourceSettings {
        jsonData = jsonData == null || jsonData.isNull() ? JsonNodeFactory.instance.objectNode() : jsonData;
        secureJsonData = secureJsonData == null ? Map.of() : Map.copyOf(secureJsonData);
    }

    /**
     * Reads the host representation {@code {"jsonData": {...}, "secureJsonData": {...}}}.
     */
    public static DatasourceSettings fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("datasource settings must be a JSON object");
        }
        JsonNode plain = root.path("jsonData");
        if (!plain.isMissingNode() && !plain.isNull() && !plain.isObject()) {
            throw new ConfigException("jsonData must be a JSON object");
        }
        JsonNode secured = root.path("secureJsonData");
        Map<String, String> secure = new LinkedHashMap<>();
        if (secured.isObject()) {
            secured.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (!value.isNull()) {
                    secure.put(entry.getKey(), value.isTextual() ? value.asText() : value.toString());
                }
            });
        } else if (!secured.isMissingNode() && !secured.isNull()) {
            throw new ConfigException("secureJsonData must be a JSON object");
        }
        return new DatasourceSettings(plain.isObject() ? plain : null, secure);
    }

    public String environment() {
        return plain("environment").orElse("");
    }

    public String tenancyMode() {
        return plain("tenancyMode").orElse("");
    }

    public boolean multitenancy() {
        return MODE_MULTITENANCY.equals(tenancyMode());
    }

    /**
     * Tenancy targeted through a cross-tenancy instance principal, if configured.
     */
    public Optional<String> crossTenancy() {
        return plain("xtenancy0").filter(value -> !value.isBlank());
    }

    /**
     * A textual value of the plain blob. Present when the key exists and is not null.
     */
    public Optional<String> plain(String key) {
        JsonNode value = jsonData.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isTextual() ? value.asText() : value.toString());
    }
}
