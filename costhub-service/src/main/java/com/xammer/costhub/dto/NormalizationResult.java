package com.xammer.costhub.dto;

import com.xammer.costhub.domain.CostRecommendation;

import java.util.Optional;

/**
 * Outcome of normalizing one raw record: exactly one of recommendation or skip reason is present.
 */
public final class NormalizationResult {

    private final CostRecommendation recommendation;
    private final SkipReason skipReason;

    private NormalizationResult(CostRecommendation recommendation, SkipReason skipReason) {
        this.recommendation = recommendation;
        this.skipReason = skipReason;
    }

    public static NormalizationResult success(CostRecommendation recommendation) {
        return new NormalizationResult(recommendation, null);
    }

    public static NormalizationResult skipped(SkipReason reason) {
        return new NormalizationResult(null, reason);
    }

    public boolean isSuccess() {
        return recommendation != null;
    }

    public Optional<CostRecommendation> getRecommendation() {
        return Optional.ofNullable(recommendation);
    }

    public Optional<SkipReason> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }
}
