package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Category {
    COMPUTE("compute"),
    STORAGE("storage"),
    DATABASE("database"),
    NETWORKING("networking"),
    COMMITMENT("commitment"),
    GENERAL("general");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
