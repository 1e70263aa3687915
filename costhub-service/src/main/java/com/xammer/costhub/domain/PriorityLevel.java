package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PriorityLevel {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String wireName;
    private final int weight;

    PriorityLevel(String wireName, int weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Numeric tier used when blending cost priority with other signals. */
    public int getWeight() {
        return weight;
    }

    public static PriorityLevel fromScore(double score) {
        if (score >= 75) {
            return HIGH;
        }
        if (score >= 50) {
            return MEDIUM;
        }
        return LOW;
    }
}
