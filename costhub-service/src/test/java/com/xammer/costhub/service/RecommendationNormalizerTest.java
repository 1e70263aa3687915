package com.xammer.costhub.service;

import com.xammer.costhub.MutableClock;
import com.xammer.costhub.domain.AffectedResource;
import com.xammer.costhub.domain.Category;
import com.xammer.costhub.domain.ConfidenceLevel;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.ImplementationEffort;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.domain.RecommendationStatus;
import com.xammer.costhub.dto.NormalizationResult;
import com.xammer.costhub.dto.raw.CohRawRecommendation;
import com.xammer.costhub.dto.raw.RawRecommendation;
import com.xammer.costhub.dto.raw.RightsizingRawRecommendation;
import com.xammer.costhub.dto.raw.SavingsPlansRawRecommendation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.xammer.costhub.service.TestRecommendations.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationNormalizerTest {

    private final RecommendationNormalizer normalizer = new RecommendationNormalizer(new MutableClock(NOW));

    @Test
    void mapsCostOptimizationHubRecord() {
        CostRecommendation rec = success(normalizer.normalize(CohRawRecommendation.builder()
                .recommendationId("abc123")
                .accountId("111122223333")
                .region("us-east-1")
                .resourceId("arn:aws:ec2:us-east-1:111122223333:volume/vol-0a1b2c")
                .currentResourceType("EbsVolume")
                .actionType("Delete")
                .implementationEffort("VeryLow")
                .restartNeeded(false)
                .rollbackPossible(false)
                .estimatedMonthlySavings(12.5)
                .estimatedMonthlyCost(50.0)
                .build()));

        assertEquals("coh-abc123", rec.getId());
        assertEquals(RecommendationSource.COH, rec.getSource());
        assertEquals(Category.STORAGE, rec.getCategory());
        assertEquals("ebs", rec.getService());
        assertEquals(150.0, rec.getAnnualSavings());
        assertEquals(ConfidenceLevel.HIGH, rec.getConfidenceLevel());
        assertEquals(ImplementationEffort.LOW, rec.getImplementationEffort());
        assertEquals(RecommendationStatus.NEW, rec.getStatus());
        assertEquals(1, rec.getResourceCount());
        assertEquals(25, rec.getEstimatedSavingsPercentage());
        assertEquals("vol-0a1b2c", rec.getCurrentResourceSummary());
        assertEquals("Detach volume from instance, create a snapshot and delete.", rec.getRecommendedResourceSummary());
        assertEquals("Delete idle or unused resources", rec.getTopRecommendedAction());
        assertEquals(ActionKind.DELETE.getImplementationSteps(), rec.getImplementationSteps());
        assertTrue(rec.getRequiredPermissions().contains("cost-optimization-hub:ListRecommendations"));
        assertTrue(rec.getPotentialRisks().contains("Change cannot be rolled back automatically"));
        assertEquals(NOW, rec.getCreatedDate());
    }

    @Test
    void gravitonTargetIsRecognized() {
        CostRecommendation rec = success(normalizer.normalize(CohRawRecommendation.builder()
                .recommendationId("g1")
                .resourceId("i-0123")
                .currentResourceType("Ec2Instance")
                .actionType("Rightsize")
                .recommendedResourceType("m7g.large")
                .estimatedMonthlySavings(30.0)
                .build()));

        assertEquals("Migrate to m7g.large", rec.getRecommendedResourceSummary());
        assertEquals("Migrate to Graviton", rec.getTopRecommendedAction());
        assertEquals(100, rec.getEstimatedSavingsPercentage());
    }

    @Test
    void nonFiniteAmountsCountAsZero() {
        CostRecommendation rec = success(normalizer.normalize(CohRawRecommendation.builder()
                .recommendationId("inf1")
                .resourceId("i-0123")
                .currentResourceType("Ec2Instance")
                .actionType("Rightsize")
                .estimatedMonthlySavings(Double.POSITIVE_INFINITY)
                .estimatedMonthlyCost(Double.NaN)
                .build()));

        assertEquals(0.0, rec.getMonthlySavings());
        assertEquals(0.0, rec.getAnnualSavings());
        assertEquals(0.0, rec.getEstimatedMonthlyCost());
        assertEquals(0, rec.getEstimatedSavingsPercentage());
        assertEquals(100, RecommendationNormalizer.savingsPercentage(10.0, Double.POSITIVE_INFINITY));
    }

    @Test
    void upstreamSummaryWins() {
        CostRecommendation rec = success(normalizer.normalize(CohRawRecommendation.builder()
                .recommendationId("s1")
                .resourceId("i-0123")
                .currentResourceType("Ec2Instance")
                .actionType("Rightsize")
                .recommendedResourceSummary(" t3.small ")
                .build()));

        assertEquals("t3.small", rec.getRecommendedResourceSummary());
    }

    @Test
    void missingHubIdIsSkipped() {
        NormalizationResult result = normalizer.normalize(CohRawRecommendation.builder().resourceId("i-1").build());

        assertFalse(result.isSuccess());
        assertEquals(RecommendationSource.COH, result.getSkipReason().orElseThrow().getSource());
        assertTrue(result.getSkipReason().orElseThrow().getReason().contains("missing recommendation id"));
    }

    @Test
    void mapsRightsizingModification() {
        CostRecommendation rec = success(normalizer.normalize(RightsizingRawRecommendation.builder()
                .resourceId("i-0abc")
                .instanceName("web-1")
                .instanceType("m5.2xlarge")
                .region("eu-west-1")
                .rightsizingType("MODIFY")
                .targetInstanceType("m5.xlarge")
                .currentMonthlyCost(280.0)
                .estimatedMonthlySavings(140.0)
                .maxCpuUtilization(12.5)
                .build()));

        assertEquals("ce-i-0abc-modify", rec.getId());
        assertEquals(RecommendationSource.COST_EXPLORER, rec.getSource());
        assertEquals(Category.COMPUTE, rec.getCategory());
        assertEquals("ec2", rec.getService());
        assertEquals(ConfidenceLevel.MEDIUM, rec.getConfidenceLevel());
        assertEquals(ImplementationEffort.MEDIUM, rec.getImplementationEffort());
        assertEquals(50, rec.getEstimatedSavingsPercentage());
        assertEquals("Change instance type to m5.xlarge", rec.getRecommendedResourceSummary());
        assertTrue(rec.getDescription().contains("12.5%"));
        assertTrue(rec.getRequiredPermissions().contains("ec2:ModifyInstanceAttribute"));
        assertEquals("eu-west-1", rec.getAffectedResources().get(0).getRegion());
    }

    @Test
    void mapsRightsizingTermination() {
        CostRecommendation rec = success(normalizer.normalize(RightsizingRawRecommendation.builder()
                .resourceId("i-0dead")
                .rightsizingType("TERMINATE")
                .currentMonthlyCost(40.0)
                .estimatedMonthlySavings(40.0)
                .build()));

        assertEquals("ce-i-0dead-terminate", rec.getId());
        assertEquals(ConfidenceLevel.HIGH, rec.getConfidenceLevel());
        assertEquals(ImplementationEffort.LOW, rec.getImplementationEffort());
        assertEquals(100, rec.getEstimatedSavingsPercentage());
        assertTrue(rec.getRequiredPermissions().contains("ec2:TerminateInstances"));
    }

    @Test
    void mapsSavingsPlansPurchase() {
        CostRecommendation rec = success(normalizer.normalize(SavingsPlansRawRecommendation.builder()
                .recommendationDetailId("d-1")
                .savingsPlansType("COMPUTE_SP")
                .termInYears("THREE_YEARS")
                .paymentOption("NO_UPFRONT")
                .lookbackPeriod("THIRTY_DAYS")
                .hourlyCommitment(1.25)
                .estimatedMonthlySavings(300.0)
                .estimatedMonthlyOnDemandCost(1200.0)
                .build()));

        assertEquals("sp-d-1", rec.getId());
        assertEquals(Category.COMMITMENT, rec.getCategory());
        assertEquals("savings_plans", rec.getService());
        assertEquals("Purchase Compute Savings Plan (3 year, No Upfront)", rec.getTitle());
        assertTrue(rec.getAffectedResources().isEmpty());
        assertEquals(0, rec.getResourceCount());
        assertEquals(25, rec.getEstimatedSavingsPercentage());
        assertEquals("Purchase Savings Plans for flexible compute usage", rec.getRecommendedResourceSummary());
        assertEquals("Current configuration", rec.getCurrentResourceSummary());
    }

    @Test
    void unexpectedFailureBecomesSkip() {
        RawRecommendation broken = new CohRawRecommendation() {
            @Override
            public String getRecommendationId() {
                throw new IllegalStateException("corrupt record");
            }
        };

        NormalizationResult result = normalizer.normalize(broken);

        assertFalse(result.isSuccess());
        assertTrue(result.getSkipReason().orElseThrow().getReason().contains("corrupt record"));
    }

    @Test
    void normalizeAllKeepsOneResultPerRecord() {
        List<RawRecommendation> records = new ArrayList<>();
        records.add(CohRawRecommendation.builder().recommendationId("1").build());
        records.add(null);
        records.add(RightsizingRawRecommendation.builder().build());

        List<NormalizationResult> results = normalizer.normalizeAll(records);

        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertFalse(results.get(2).isSuccess());
    }

    @Test
    void savingsPercentageRules() {
        assertEquals(25, RecommendationNormalizer.savingsPercentage(25.0, 100.0));
        assertEquals(100, RecommendationNormalizer.savingsPercentage(150.0, 100.0));
        assertEquals(100, RecommendationNormalizer.savingsPercentage(10.0, 0.0));
        assertEquals(100, RecommendationNormalizer.savingsPercentage(10.0, null));
        assertEquals(0, RecommendationNormalizer.savingsPercentage(0.0, null));
        assertEquals(33, RecommendationNormalizer.savingsPercentage(1.0, 3.0));
    }

    @Test
    void displayIdTakesLastSegment() {
        assertEquals("i-0abc", RecommendationNormalizer.displayId("arn:aws:ec2:us-east-1:123:instance/i-0abc"));
        assertEquals("my-fn", RecommendationNormalizer.displayId("arn:aws:lambda:us-east-1:123:function:my-fn"));
        assertEquals("vol-1", RecommendationNormalizer.displayId("vol-1"));
    }

    @Test
    void currentSummaryListsAtMostThreeIds() {
        List<AffectedResource> resources = List.of(
                new AffectedResource("a/r1", "t", null),
                new AffectedResource("r2", "t", null),
                new AffectedResource("r3", "t", null),
                new AffectedResource("r4", "t", null),
                new AffectedResource("r5", "t", null));

        assertEquals("r1, r2, r3 (+2 more)", RecommendationNormalizer.currentSummary(resources));
        assertEquals("Current configuration", RecommendationNormalizer.currentSummary(List.of()));
    }

    @Test
    void recommendedSummaryFallsBackToDescriptionThenGeneric() {
        assertEquals("Turn it off.", RecommendationNormalizer.recommendedSummary(null, ActionKind.OTHER,
                Category.GENERAL, "Resource", null, "Turn it off. It is unused."));
        assertEquals(RecommendationNormalizer.GENERIC_RECOMMENDED_SUMMARY, RecommendationNormalizer.recommendedSummary(
                null, ActionKind.OTHER, Category.GENERAL, "Resource", null, null));
    }

    private static CostRecommendation success(NormalizationResult result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result.getSkipReason().orElse(null));
        CostRecommendation rec = result.getRecommendation().orElseThrow();
        assertEquals(CostRecommendation.annualize(rec.getMonthlySavings()), rec.getAnnualSavings());
        assertFalse(rec.getRecommendedResourceSummary().isBlank());
        assertFalse(rec.getCurrentResourceSummary().isBlank());
        assertEquals(rec.getAffectedResources().size(), rec.getResourceCount());
        return rec;
    }
}
