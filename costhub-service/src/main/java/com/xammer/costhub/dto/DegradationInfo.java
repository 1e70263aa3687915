package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.service.resilience.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DegradationInfo {
    private DegradationStatus status;
    private double successRatio;
    @Builder.Default
    private List<RecommendationSource> availableSources = new ArrayList<>();
    @Builder.Default
    private List<RecommendationSource> failedSources = new ArrayList<>();
    private int recommendationCount;
    private boolean hasExecutiveSummary;
    private String message;
    @Builder.Default
    private Map<String, CircuitState> circuitStates = new LinkedHashMap<>();
}
