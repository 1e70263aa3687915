package com.xammer.costhub.service.source;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.dto.raw.SavingsPlansRawRecommendation;
import com.xammer.costhub.service.AwsClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.GetSavingsPlansPurchaseRecommendationRequest;
import software.amazon.awssdk.services.costexplorer.model.GetSavingsPlansPurchaseRecommendationResponse;
import software.amazon.awssdk.services.costexplorer.model.LookbackPeriodInDays;
import software.amazon.awssdk.services.costexplorer.model.PaymentOption;
import software.amazon.awssdk.services.costexplorer.model.SavingsPlansPurchaseRecommendation;
import software.amazon.awssdk.services.costexplorer.model.SavingsPlansPurchaseRecommendationDetail;
import software.amazon.awssdk.services.costexplorer.model.SupportedSavingsPlansType;
import software.amazon.awssdk.services.costexplorer.model.TermInYears;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Savings Plans purchase recommendations, one request per configured term.
 */
@Component
public class SavingsPlansSourceClient implements RecommendationSourceClient<SavingsPlansRawRecommendation> {

    private static final Logger logger = LoggerFactory.getLogger(SavingsPlansSourceClient.class);

    static final double HOURS_PER_MONTH = 730.0;

    private final Supplier<CostExplorerClient> clientSupplier;
    private final String savingsPlansType;
    private final List<String> terms;
    private final String paymentOption;
    private final String lookbackPeriod;

    @Autowired
    public SavingsPlansSourceClient(AwsClientProvider awsClientProvider,
                                    @Value("${costhub.savings-plans.type:COMPUTE_SP}") String savingsPlansType,
                                    @Value("${costhub.savings-plans.terms:ONE_YEAR,THREE_YEARS}") List<String> terms,
                                    @Value("${costhub.savings-plans.payment-option:NO_UPFRONT}") String paymentOption,
                                    @Value("${costhub.savings-plans.lookback-period:THIRTY_DAYS}") String lookbackPeriod) {
        this(awsClientProvider::getCostExplorerClient, savingsPlansType, terms, paymentOption, lookbackPeriod);
    }

    public SavingsPlansSourceClient(Supplier<CostExplorerClient> clientSupplier, String savingsPlansType,
                                    List<String> terms, String paymentOption, String lookbackPeriod) {
        this.clientSupplier = clientSupplier;
        this.savingsPlansType = savingsPlansType;
        this.terms = List.copyOf(terms);
        this.paymentOption = paymentOption;
        this.lookbackPeriod = lookbackPeriod;
    }

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.SAVINGS_PLANS;
    }

    @Override
    public List<SavingsPlansRawRecommendation> fetch(String region, int maxResults, FetchFilters filters) {
        List<SavingsPlansRawRecommendation> results = new ArrayList<>();
        try {
            CostExplorerClient client = clientSupplier.get();
            for (String term : terms) {
                if (results.size() >= maxResults) {
                    break;
                }
                GetSavingsPlansPurchaseRecommendationRequest request = GetSavingsPlansPurchaseRecommendationRequest.builder()
                        .savingsPlansType(SupportedSavingsPlansType.fromValue(savingsPlansType))
                        .termInYears(TermInYears.fromValue(term))
                        .paymentOption(PaymentOption.fromValue(paymentOption))
                        .lookbackPeriodInDays(LookbackPeriodInDays.fromValue(lookbackPeriod))
                        .build();
                GetSavingsPlansPurchaseRecommendationResponse response = client.getSavingsPlansPurchaseRecommendation(request);
                SavingsPlansPurchaseRecommendation recommendation = response.savingsPlansPurchaseRecommendation();
                if (recommendation == null) {
                    logger.debug("No Savings Plans recommendation for term {}", term);
                    continue;
                }
                for (SavingsPlansPurchaseRecommendationDetail detail : recommendation.savingsPlansPurchaseRecommendationDetails()) {
                    if (results.size() >= maxResults) {
                        break;
                    }
                    results.add(toRaw(detail, term, region));
                }
            }
        } catch (RuntimeException e) {
            throw AwsErrorClassifier.classify(getSource(), e);
        }
        logger.info("Fetched {} Savings Plans purchase recommendations", results.size());
        return results;
    }

    private SavingsPlansRawRecommendation toRaw(SavingsPlansPurchaseRecommendationDetail detail, String term,
                                                String region) {
        double averageHourlyOnDemand = CostExplorerRightsizingClient.parseAmount(detail.currentAverageHourlyOnDemandSpend());
        SavingsPlansRawRecommendation.SavingsPlansRawRecommendationBuilder builder = SavingsPlansRawRecommendation.builder()
                .recommendationDetailId(detail.recommendationDetailId())
                .accountId(detail.accountId())
                .savingsPlansType(savingsPlansType)
                .termInYears(term)
                .paymentOption(paymentOption)
                .lookbackPeriod(lookbackPeriod)
                .region(region)
                .hourlyCommitment(CostExplorerRightsizingClient.parseAmount(detail.hourlyCommitmentToPurchase()))
                .estimatedMonthlySavings(CostExplorerRightsizingClient.parseAmount(detail.estimatedMonthlySavingsAmount()))
                .estimatedMonthlyOnDemandCost(averageHourlyOnDemand * HOURS_PER_MONTH)
                .estimatedSavingsPercentage(CostExplorerRightsizingClient.parseAmount(detail.estimatedSavingsPercentage()))
                .upfrontCost(CostExplorerRightsizingClient.parseAmount(detail.upfrontCost()));
        if (detail.savingsPlansDetails() != null) {
            builder.instanceFamily(detail.savingsPlansDetails().instanceFamily());
            if (detail.savingsPlansDetails().region() != null) {
                builder.region(detail.savingsPlansDetails().region());
            }
        }
        return builder.build();
    }
}
