package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataQualityStatus {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String wireName;

    DataQualityStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static DataQualityStatus of(double completeness, double reliability) {
        if (completeness >= 0.8 && reliability >= 0.8) {
            return EXCELLENT;
        }
        if (completeness >= 0.6 && reliability >= 0.6) {
            return GOOD;
        }
        if (completeness >= 0.3 && reliability >= 0.4) {
            return FAIR;
        }
        return POOR;
    }
}
