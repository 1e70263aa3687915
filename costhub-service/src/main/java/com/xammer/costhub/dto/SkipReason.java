package com.xammer.costhub.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.xammer.costhub.domain.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkipReason {
    private RecommendationSource source;

    @JsonProperty("record_id")
    private String recordId;

    private String reason;

    @Override
    public String toString() {
        return (source == null ? "Unknown source" : source.getDisplayName()) + " record " + (recordId == null ? "<unknown>" : recordId) + " skipped: " + reason;
    }
}
