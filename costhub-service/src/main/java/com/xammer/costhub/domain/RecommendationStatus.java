package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a recommendation. Only NEW is assigned here; consumers move it forward.
 */
public enum RecommendationStatus {
    /** Freshly collected, nobody has looked at it yet. */
    NEW("new"),
    /** Seen by an operator. */
    REVIEWED("reviewed"),
    /** Change applied in the account. */
    IMPLEMENTED("implemented"),
    /** Rejected by an operator. */
    DISMISSED("dismissed");

    private final String wireName;

    RecommendationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
