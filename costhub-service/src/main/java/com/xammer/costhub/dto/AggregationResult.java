package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.costhub.domain.CostRecommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a run produces. {@code executiveSummary} and {@code recommendations} are never null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregationResult {
    private ExecutiveSummary executiveSummary;
    @Builder.Default
    private List<CostRecommendation> recommendations = new ArrayList<>();
    @Builder.Default
    private List<String> errorMessages = new ArrayList<>();
    private Instant dataCollectionTime;
    private DataQuality dataQuality;
    private DegradationInfo gracefulDegradationInfo;
    private ValidationReport dataQualitySummary;
    private AnomalyReport anomalies;
    private MonitoringReport monitoring;
}
