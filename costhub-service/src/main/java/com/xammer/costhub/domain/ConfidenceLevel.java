package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

public enum ConfidenceLevel {
    HIGH("high", 20),
    MEDIUM("medium", 15),
    LOW("low", 10);

    private static final Map<String, ConfidenceLevel> LOOKUP = Map.of(
            "VERYLOW", LOW,
            "LOW", LOW,
            "MEDIUM", MEDIUM,
            "HIGH", HIGH,
            "VERYHIGH", HIGH
    );

    private final String wireName;
    private final int score;

    ConfidenceLevel(String wireName, int score) {
        this.wireName = wireName;
        this.score = score;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getScore() {
        return score;
    }

    /**
     * Accepts both VERY_LOW and VeryLow spellings. Anything unrecognised maps to MEDIUM.
     */
    public static ConfidenceLevel fromUpstream(String value) {
        if (value == null) {
            return MEDIUM;
        }
        return LOOKUP.getOrDefault(value.trim().toUpperCase(Locale.ROOT).replace("_", ""), MEDIUM);
    }
}
