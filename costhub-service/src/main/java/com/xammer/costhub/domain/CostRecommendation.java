package com.xammer.costhub.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One actionable savings opportunity, normalized from whichever provider reported it.
 * Priority fields are only meaningful relative to the other recommendations of the same run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CostRecommendation {
    private String id;
    private RecommendationSource source;
    private Category category;
    private String service;
    private String title;
    private String description;

    private double monthlySavings;
    private double annualSavings;

    private ConfidenceLevel confidenceLevel;
    private ImplementationEffort implementationEffort;

    @Builder.Default
    private List<String> implementationSteps = new ArrayList<>();
    @Builder.Default
    private List<String> requiredPermissions = new ArrayList<>();
    @Builder.Default
    private List<String> potentialRisks = new ArrayList<>();
    @Builder.Default
    private List<AffectedResource> affectedResources = new ArrayList<>();
    private int resourceCount;

    private double priorityScore;
    private PriorityLevel priorityLevel;

    private Instant createdDate;
    private Instant lastUpdated;
    @Builder.Default
    private RecommendationStatus status = RecommendationStatus.NEW;

    // Presentation fields
    private String topRecommendedAction;
    private String recommendedResourceSummary;
    private String currentResourceSummary;
    private double estimatedMonthlyCost;
    private int estimatedSavingsPercentage;
    private String region;
    private String accountId;
    private boolean restartRequired;
    private boolean rollbackPossible;
    private String resourceType;

    public static double annualize(double monthlySavings) {
        return Math.round(monthlySavings * 12 * 100.0) / 100.0;
    }
}
