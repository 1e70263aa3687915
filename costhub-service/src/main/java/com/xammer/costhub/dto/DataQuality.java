package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.costhub.domain.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DataQuality {
    private DataQualityStatus status;
    private double completeness;
    private double reliability;
    @Builder.Default
    private List<RecommendationSource> availableSources = new ArrayList<>();
    private int totalRecommendations;
    private int errorCount;
}
