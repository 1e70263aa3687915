package com.xammer.costhub.dto.raw;

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
public class RightsizingRawRecommendation implements RawRecommendation {
    private String accountId;
    private String resourceId;
    private String instanceName;
    private String instanceType;
    private String region;
    /** TERMINATE or MODIFY. */
    private String rightsizingType;
    private String targetInstanceType;
    private Double currentMonthlyCost;
    private Double estimatedMonthlySavings;
    private Double maxCpuUtilization;
    @Builder.Default
    private List<String> findingReasonCodes = new ArrayList<>();

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.COST_EXPLORER;
    }
}
