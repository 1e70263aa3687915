package com.xammer.costhub.dto.raw;

import com.xammer.costhub.domain.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsPlansRawRecommendation implements RawRecommendation {
    private String recommendationDetailId;
    private String accountId;
    private String savingsPlansType;
    private String termInYears;
    private String paymentOption;
    private String lookbackPeriod;
    private String instanceFamily;
    private String region;
    private Double hourlyCommitment;
    private Double estimatedMonthlySavings;
    private Double estimatedMonthlyOnDemandCost;
    private Double estimatedSavingsPercentage;
    private Double upfrontCost;

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.SAVINGS_PLANS;
    }
}
