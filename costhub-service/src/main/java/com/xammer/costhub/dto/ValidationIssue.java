package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssue {
    @JsonProperty("recommendation_id")
    private String recommendationId;

    private String field;
    private String message;
}
