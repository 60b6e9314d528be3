package com.ocilogs.frame;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValueType {
    FLOAT64("float64"),
    INT("int64"),
    TIME("time"),
    STRING("string");

    private final String wireName;

    ValueType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
