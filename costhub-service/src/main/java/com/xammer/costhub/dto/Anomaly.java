package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {
    @JsonProperty("recommendation_id")
    private String recommendationId;

    private AnomalyType type;

    @JsonProperty("monthly_savings")
    private double monthlySavings;

    private String description;
}
