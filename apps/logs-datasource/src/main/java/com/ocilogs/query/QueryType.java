package com.ocilogs.query;

import java.util.Arrays;

public enum QueryType {
    COMPARTMENTS("compartments"),
    REGIONS("regions"),
    SEARCH_LOGS("searchLogs"),
    TEST("test");

    private final String wireName;

    QueryType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves the request value; anything unrecognised is a log search.
     */
    public static QueryType from(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst()
                .orElse(SEARCH_LOGS);
    }
}
