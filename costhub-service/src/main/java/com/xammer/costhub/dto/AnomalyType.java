package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    EXTREME_SAVINGS("extreme_savings"),
    ROUND_NUMBER_ESTIMATE("round_number_estimate"),
    VERY_LOW_SAVINGS("very_low_savings"),
    PRIORITY_SAVINGS_MISMATCH("priority_savings_mismatch");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
