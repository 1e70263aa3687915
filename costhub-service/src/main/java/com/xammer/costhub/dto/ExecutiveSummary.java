package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.costhub.domain.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutiveSummary {
    private int totalRecommendations;
    private double totalMonthlySavings;
    private double totalAnnualSavings;
    private int highPriorityCount;
    private int mediumPriorityCount;
    private int lowPriorityCount;
    @Builder.Default
    private List<CategorySavings> topCategories = new ArrayList<>();
    @Builder.Default
    private List<RoadmapPhase> implementationRoadmap = new ArrayList<>();
    private Instant dataFreshness;

    public static ExecutiveSummary empty(Instant dataFreshness) {
        return ExecutiveSummary.builder().dataFreshness(dataFreshness).build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategorySavings {
        private Category category;
        private double savings;
        private int count;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RoadmapPhase {
        private String phase;
        private String timeframe;
        private int count;
        private double totalSavings;
        private String description;
        @Builder.Default
        private List<String> recommendationIds = new ArrayList<>();
    }
}
