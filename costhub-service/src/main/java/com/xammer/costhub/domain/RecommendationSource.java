package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Upstream providers feeding the aggregation run. Declaration order is the order
 * in which per-source results are concatenated.
 */
public enum RecommendationSource {
    COH("coh", "Cost Optimization Hub"),
    COST_EXPLORER("cost_explorer", "Cost Explorer"),
    SAVINGS_PLANS("savings_plans", "Savings Plans");

    private final String wireName;
    private final String displayName;

    RecommendationSource(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
