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
public class ValidationReport {
    private int totalProcessed;
    private int validCount;
    private int removedCount;
    private int correctedCount;
    @Builder.Default
    private List<ValidationIssue> errors = new ArrayList<>();
    @Builder.Default
    private List<ValidationIssue> fixes = new ArrayList<>();
    private double qualityScore;

    public static ValidationReport empty() {
        return ValidationReport.builder().qualityScore(1.0).build();
    }
}
