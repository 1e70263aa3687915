package com.xammer.costhub.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
public class AnomalyReport {
    /** False when the batch was too small to analyze. */
    private boolean analyzed;
    private double mean;
    private double median;
    private double standardDeviation;
    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    public static AnomalyReport notAnalyzed() {
        return AnomalyReport.builder().analyzed(false).build();
    }
}
