package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.costhub.domain.AffectedResource;
import com.xammer.costhub.domain.PriorityLevel;
import com.xammer.costhub.domain.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation of cost recommendations with security findings on the same resources.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CrossReferenceReport {
    @Builder.Default
    private List<IntegratedRecommendation> integratedRecommendations = new ArrayList<>();
    @Builder.Default
    private List<Conflict> costSecurityConflicts = new ArrayList<>();
    @Builder.Default
    private List<ComplementaryAction> complementaryActions = new ArrayList<>();
    @Builder.Default
    private Map<String, ResourceOverlap> resourceOverlapAnalysis = new LinkedHashMap<>();
    @Builder.Default
    private List<UnifiedActionPlan> unifiedActionPlans = new ArrayList<>();
    private Summary summary;

    public static CrossReferenceReport empty(int totalRecommendations) {
        return CrossReferenceReport.builder()
                .summary(new Summary(totalRecommendations, 0, 0, 0, 0, 0))
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class IntegratedRecommendation {
        private String recommendationId;
        private String costRecommendationId;
        private String title;
        private double monthlySavings;
        private double annualSavings;
        private PriorityLevel costPriority;
        private Severity maxSeverity;
        private int affectedFindings;
        @Builder.Default
        private List<String> securityServices = new ArrayList<>();
        private double integratedScore;
        private PriorityLevel priority;
        @Builder.Default
        private List<String> integratedSteps = new ArrayList<>();
        @Builder.Default
        private List<AffectedResource> affectedResources = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Conflict {
        private String type;
        private String costRecommendationId;
        private String securityFindingId;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ComplementaryAction {
        private String type;
        private String costRecommendationId;
        @Builder.Default
        private List<String> securityFindingIds = new ArrayList<>();
        @Builder.Default
        private List<String> costBenefits = new ArrayList<>();
        @Builder.Default
        private List<String> securityBenefits = new ArrayList<>();
        @Builder.Default
        private List<String> recommendedActions = new ArrayList<>();
        private PriorityLevel priority;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ResourceOverlap {
        private List<String> costRecommendationIds = new ArrayList<>();
        private List<String> securityFindingIds = new ArrayList<>();
        private double monthlySavings;
        private Severity maxSeverity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class UnifiedActionPlan {
        private String resourceId;
        /** critical, high or medium. */
        private String priority;
        private double totalMonthlySavings;
        private int costRecommendationsCount;
        private int securityFindingsCount;
        private String recommendedApproach;
        @Builder.Default
        private List<String> implementationOrder = new ArrayList<>();
        @Builder.Default
        private Map<String, List<String>> riskMitigation = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private int totalCostRecommendations;
        private int totalSecurityFindings;
        private int totalOverlappingResources;
        private int integratedRecommendationsCount;
        private int conflictsIdentified;
        private int complementaryActionsCount;
    }
}
