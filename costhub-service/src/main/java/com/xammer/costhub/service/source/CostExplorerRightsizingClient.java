package com.xammer.costhub.service.source;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.dto.raw.RightsizingRawRecommendation;
import com.xammer.costhub.service.AwsClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.CurrentInstance;
import software.amazon.awssdk.services.costexplorer.model.GetRightsizingRecommendationRequest;
import software.amazon.awssdk.services.costexplorer.model.GetRightsizingRecommendationResponse;
import software.amazon.awssdk.services.costexplorer.model.ModifyRecommendationDetail;
import software.amazon.awssdk.services.costexplorer.model.RecommendationTarget;
import software.amazon.awssdk.services.costexplorer.model.RightsizingRecommendation;
import software.amazon.awssdk.services.costexplorer.model.RightsizingRecommendationConfiguration;
import software.amazon.awssdk.services.costexplorer.model.TargetInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * EC2 rightsizing recommendations from Cost Explorer. The API is global and served from us-east-1.
 */
@Component
public class CostExplorerRightsizingClient implements RecommendationSourceClient<RightsizingRawRecommendation> {

    private static final Logger logger = LoggerFactory.getLogger(CostExplorerRightsizingClient.class);

    private static final int MAX_PAGE_SIZE = 100;

    private final Supplier<CostExplorerClient> clientSupplier;
    private final RecommendationTarget recommendationTarget;
    private final boolean benefitsConsidered;

    @Autowired
    public CostExplorerRightsizingClient(AwsClientProvider awsClientProvider,
                                         @Value("${costhub.cost-explorer.recommendation-target:SAME_INSTANCE_FAMILY}") String recommendationTarget,
                                         @Value("${costhub.cost-explorer.benefits-considered:true}") boolean benefitsConsidered) {
        this(awsClientProvider::getCostExplorerClient, RecommendationTarget.fromValue(recommendationTarget),
                benefitsConsidered);
    }

    public CostExplorerRightsizingClient(Supplier<CostExplorerClient> clientSupplier,
                                         RecommendationTarget recommendationTarget, boolean benefitsConsidered) {
        this.clientSupplier = clientSupplier;
        this.recommendationTarget = recommendationTarget;
        this.benefitsConsidered = benefitsConsidered;
    }

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.COST_EXPLORER;
    }

    @Override
    public List<RightsizingRawRecommendation> fetch(String region, int maxResults, FetchFilters filters) {
        List<RightsizingRawRecommendation> results = new ArrayList<>();
        String nextPageToken = null;
        try {
            CostExplorerClient client = clientSupplier.get();
            do {
                GetRightsizingRecommendationRequest request = GetRightsizingRecommendationRequest.builder()
                        .service("AmazonEC2")
                        .configuration(RightsizingRecommendationConfiguration.builder()
                                .benefitsConsidered(benefitsConsidered)
                                .recommendationTarget(recommendationTarget)
                                .build())
                        .pageSize(Math.min(MAX_PAGE_SIZE, maxResults - results.size()))
                        .nextPageToken(nextPageToken)
                        .build();
                GetRightsizingRecommendationResponse response = client.getRightsizingRecommendation(request);
                for (RightsizingRecommendation rec : response.rightsizingRecommendations()) {
                    if (results.size() >= maxResults) {
                        break;
                    }
                    results.add(toRaw(rec, region));
                }
                nextPageToken = response.nextPageToken();
            } while (nextPageToken != null && !nextPageToken.isEmpty() && results.size() < maxResults);
        } catch (RuntimeException e) {
            throw AwsErrorClassifier.classify(getSource(), e);
        }
        logger.info("Fetched {} Cost Explorer rightsizing recommendations", results.size());
        return results;
    }

    private RightsizingRawRecommendation toRaw(RightsizingRecommendation rec, String fallbackRegion) {
        CurrentInstance current = rec.currentInstance();
        RightsizingRawRecommendation.RightsizingRawRecommendationBuilder builder = RightsizingRawRecommendation.builder()
                .accountId(rec.accountId())
                .rightsizingType(rec.rightsizingTypeAsString())
                .findingReasonCodes(new ArrayList<>(rec.findingReasonCodesAsStrings()))
                .region(fallbackRegion);

        if (current != null) {
            builder.resourceId(current.resourceId())
                    .instanceName(current.instanceName())
                    .currentMonthlyCost(parseAmount(current.monthlyCost()));
            if (current.resourceDetails() != null && current.resourceDetails().ec2ResourceDetails() != null) {
                builder.instanceType(current.resourceDetails().ec2ResourceDetails().instanceType());
                String instanceRegion = current.resourceDetails().ec2ResourceDetails().region();
                if (instanceRegion != null && !instanceRegion.isEmpty()) {
                    builder.region(instanceRegion);
                }
            }
            if (current.resourceUtilization() != null && current.resourceUtilization().ec2ResourceUtilization() != null) {
                builder.maxCpuUtilization(parseAmount(
                        current.resourceUtilization().ec2ResourceUtilization().maxCpuUtilizationPercentage()));
            }
        }

        if (rec.terminateRecommendationDetail() != null) {
            builder.estimatedMonthlySavings(parseAmount(rec.terminateRecommendationDetail().estimatedMonthlySavings()));
        } else if (rec.modifyRecommendationDetail() != null) {
            TargetInstance target = pickTarget(rec.modifyRecommendationDetail());
            if (target != null) {
                builder.estimatedMonthlySavings(parseAmount(target.estimatedMonthlySavings()));
                if (target.resourceDetails() != null && target.resourceDetails().ec2ResourceDetails() != null) {
                    builder.targetInstanceType(target.resourceDetails().ec2ResourceDetails().instanceType());
                }
            }
        }
        return builder.build();
    }

    /** Prefers the target AWS marks as default, else the one saving the most. */
    private TargetInstance pickTarget(ModifyRecommendationDetail detail) {
        TargetInstance best = null;
        for (TargetInstance candidate : detail.targetInstances()) {
            if (Boolean.TRUE.equals(candidate.defaultTargetInstance())) {
                return candidate;
            }
            if (best == null || parseAmount(candidate.estimatedMonthlySavings()) > parseAmount(best.estimatedMonthlySavings())) {
                best = candidate;
            }
        }
        return best;
    }

    static double parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        double amount;
        try {
            amount = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Could not parse amount '{}' from Cost Explorer, using 0", value);
            return 0.0;
        }
        if (!Double.isFinite(amount)) {
            logger.warn("Non-finite amount '{}' from Cost Explorer, using 0", value);
            return 0.0;
        }
        return amount;
    }
}
