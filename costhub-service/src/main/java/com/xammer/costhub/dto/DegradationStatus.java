package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DegradationStatus {
    FULL_SERVICE("full_service"),
    PARTIAL("partial"),
    LIMITED("limited"),
    MINIMAL("minimal");

    private final String wireName;

    DegradationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static DegradationStatus fromSuccessRatio(double ratio) {
        if (ratio >= 1.0) {
            return FULL_SERVICE;
        }
        if (ratio >= 0.67) {
            return PARTIAL;
        }
        if (ratio >= 0.33) {
            return LIMITED;
        }
        return MINIMAL;
    }
}
