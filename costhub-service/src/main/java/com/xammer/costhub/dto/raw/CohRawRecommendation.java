package com.xammer.costhub.dto.raw;

import com.xammer.costhub.domain.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohRawRecommendation implements RawRecommendation {
    private String recommendationId;
    private String accountId;
    private String region;
    private String resourceId;
    private String resourceArn;
    private String currentResourceType;
    private String recommendedResourceType;
    private String actionType;
    private String implementationEffort;
    private Boolean restartNeeded;
    private Boolean rollbackPossible;
    private Double estimatedMonthlySavings;
    private Double estimatedMonthlyCost;
    private Double estimatedSavingsPercentage;
    private String currentResourceSummary;
    private String recommendedResourceSummary;
    private String upstreamSource;
    private String description;
    private Instant lastRefreshTimestamp;

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.COH;
    }
}
