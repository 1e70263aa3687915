package com.xammer.costhub.service.source;

import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.dto.raw.SavingsPlansRawRecommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.GetSavingsPlansPurchaseRecommendationRequest;
import software.amazon.awssdk.services.costexplorer.model.GetSavingsPlansPurchaseRecommendationResponse;
import software.amazon.awssdk.services.costexplorer.model.PaymentOption;
import software.amazon.awssdk.services.costexplorer.model.SavingsPlansDetails;
import software.amazon.awssdk.services.costexplorer.model.SavingsPlansPurchaseRecommendation;
import software.amazon.awssdk.services.costexplorer.model.SavingsPlansPurchaseRecommendationDetail;
import software.amazon.awssdk.services.costexplorer.model.SupportedSavingsPlansType;
import software.amazon.awssdk.services.costexplorer.model.TermInYears;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SavingsPlansSourceClientTest {

    private CostExplorerClient costExplorer;
    private SavingsPlansSourceClient client;

    @BeforeEach
    void setUp() {
        costExplorer = mock(CostExplorerClient.class);
        client = new SavingsPlansSourceClient(() -> costExplorer, "COMPUTE_SP",
                List.of("ONE_YEAR", "THREE_YEARS"), "NO_UPFRONT", "THIRTY_DAYS");
    }

    @Test
    void requestsEveryConfiguredTerm() {
        when(costExplorer.getSavingsPlansPurchaseRecommendation(any(GetSavingsPlansPurchaseRecommendationRequest.class)))
                .thenReturn(response(detail("one", "150.0")))
                .thenReturn(response(detail("three", "260.0")));

        List<SavingsPlansRawRecommendation> results = client.fetch("us-east-1", 100, FetchFilters.none());

        assertEquals(List.of("one", "three"), results.stream()
                .map(SavingsPlansRawRecommendation::getRecommendationDetailId).collect(Collectors.toList()));
        assertEquals(List.of("ONE_YEAR", "THREE_YEARS"), results.stream()
                .map(SavingsPlansRawRecommendation::getTermInYears).collect(Collectors.toList()));

        ArgumentCaptor<GetSavingsPlansPurchaseRecommendationRequest> requests =
                ArgumentCaptor.forClass(GetSavingsPlansPurchaseRecommendationRequest.class);
        verify(costExplorer, times(2)).getSavingsPlansPurchaseRecommendation(requests.capture());
        assertEquals(TermInYears.ONE_YEAR, requests.getAllValues().get(0).termInYears());
        assertEquals(TermInYears.THREE_YEARS, requests.getAllValues().get(1).termInYears());
        assertEquals(SupportedSavingsPlansType.COMPUTE_SP, requests.getAllValues().get(0).savingsPlansType());
        assertEquals(PaymentOption.NO_UPFRONT, requests.getAllValues().get(0).paymentOption());
    }

    @Test
    void mapsDetailAmounts() {
        when(costExplorer.getSavingsPlansPurchaseRecommendation(any(GetSavingsPlansPurchaseRecommendationRequest.class)))
                .thenReturn(response(detail("d1", "200.0")));

        SavingsPlansRawRecommendation raw = client.fetch("us-east-1", 1, FetchFilters.none()).get(0);

        assertEquals(200.0, raw.getEstimatedMonthlySavings());
        assertEquals(1.5, raw.getHourlyCommitment());
        assertEquals(1460.0, raw.getEstimatedMonthlyOnDemandCost(), 1e-9);
        assertEquals("m5", raw.getInstanceFamily());
        assertEquals("eu-central-1", raw.getRegion());
        verify(costExplorer, times(1)).getSavingsPlansPurchaseRecommendation(
                any(GetSavingsPlansPurchaseRecommendationRequest.class));
    }

    @Test
    void missingRecommendationYieldsNothing() {
        when(costExplorer.getSavingsPlansPurchaseRecommendation(any(GetSavingsPlansPurchaseRecommendationRequest.class)))
                .thenReturn(GetSavingsPlansPurchaseRecommendationResponse.builder().build());

        assertTrue(client.fetch("us-east-1", 100, FetchFilters.none()).isEmpty());
    }

    private static GetSavingsPlansPurchaseRecommendationResponse response(SavingsPlansPurchaseRecommendationDetail detail) {
        return GetSavingsPlansPurchaseRecommendationResponse.builder()
                .savingsPlansPurchaseRecommendation(SavingsPlansPurchaseRecommendation.builder()
                        .savingsPlansPurchaseRecommendationDetails(detail)
                        .build())
                .build();
    }

    private static SavingsPlansPurchaseRecommendationDetail detail(String id, String monthlySavings) {
        return SavingsPlansPurchaseRecommendationDetail.builder()
                .recommendationDetailId(id)
                .hourlyCommitmentToPurchase("1.5")
                .estimatedMonthlySavingsAmount(monthlySavings)
                .currentAverageHourlyOnDemandSpend("2.0")
                .estimatedSavingsPercentage("20")
                .upfrontCost("0")
                .savingsPlansDetails(SavingsPlansDetails.builder().instanceFamily("m5").region("eu-central-1").build())
                .build();
    }
}
