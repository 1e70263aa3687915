package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MonitoringReport {
    @Builder.Default
    private Map<String, Integer> sourceDistribution = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Integer> categoryDistribution = new LinkedHashMap<>();
    private SavingsStatistics savingsStatistics;
    private double freshnessScore;
    private double dataAgeMinutes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SavingsStatistics {
        private int count;
        private double total;
        private double mean;
        private double median;
        private double min;
        private double max;
    }
}
