package com.xammer.costhub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xammer.costhub.MutableClock;
import com.xammer.costhub.config.AggregationSettings;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.domain.SecurityFinding;
import com.xammer.costhub.domain.Severity;
import com.xammer.costhub.dto.AggregationResult;
import com.xammer.costhub.dto.CrossReferenceReport;
import com.xammer.costhub.dto.DataQuality;
import com.xammer.costhub.dto.DegradationStatus;
import com.xammer.costhub.dto.raw.CohRawRecommendation;
import com.xammer.costhub.dto.raw.RawRecommendation;
import com.xammer.costhub.dto.raw.RightsizingRawRecommendation;
import com.xammer.costhub.dto.raw.SavingsPlansRawRecommendation;
import com.xammer.costhub.exception.TerminalSourceException;
import com.xammer.costhub.exception.TransientSourceException;
import com.xammer.costhub.service.resilience.CircuitBreaker;
import com.xammer.costhub.service.resilience.CircuitState;
import com.xammer.costhub.service.source.RecommendationSourceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.xammer.costhub.service.TestRecommendations.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CostOptimizationServiceTest {

    private final MutableClock clock = new MutableClock(NOW);
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private ExecutorService executor;
    private DataQualityMonitor monitor;
    private RecommendationPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        monitor = new DataQualityMonitor(clock);
        pipeline = new RecommendationPipeline(new RecommendationDeduplicator(), new PriorityScorer(),
                new DataQualityValidator(), new AnomalyDetector(), new ExecutiveSummaryGenerator(), monitor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void aggregatesAvailableSourcesAndReportsFailedOne() {
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0), cohRaw("a2", "i-b", 40.0)));
        FakeSourceClient<RightsizingRawRecommendation> ce = ceClient(() -> List.of(rightsizingRaw("i-c", 60.0)));
        FakeSourceClient<SavingsPlansRawRecommendation> sp = spClient(() -> {
            throw new TerminalSourceException(RecommendationSource.SAVINGS_PLANS, "AccessDeniedException", "not authorized");
        });

        AggregationResult result = service(settings().build(), coh, ce, sp).run();

        assertEquals(3, result.getRecommendations().size());
        assertEquals(3, result.getExecutiveSummary().getTotalRecommendations());
        assertEquals(200.0, result.getExecutiveSummary().getTotalMonthlySavings());
        assertEquals(List.of(RecommendationSource.SAVINGS_PLANS), result.getGracefulDegradationInfo().getFailedSources());
        assertEquals(List.of(RecommendationSource.COH, RecommendationSource.COST_EXPLORER),
                result.getGracefulDegradationInfo().getAvailableSources());
        // 2 of 3 is below the 0.67 partial threshold
        assertEquals(DegradationStatus.LIMITED, result.getGracefulDegradationInfo().getStatus());
        assertEquals(3, result.getGracefulDegradationInfo().getRecommendationCount());
        assertTrue(result.getGracefulDegradationInfo().isHasExecutiveSummary());
        assertTrue(result.getErrorMessages().get(0).startsWith("Savings Plans unavailable [AccessDeniedException]"));
        assertTrue(result.getErrorMessages().get(1).contains("2 of 3 data sources available"));
        assertEquals(NOW, result.getDataCollectionTime());

        List<CostRecommendation> recs = result.getRecommendations();
        for (int i = 1; i < recs.size(); i++) {
            assertTrue(recs.get(i - 1).getPriorityScore() >= recs.get(i).getPriorityScore());
        }
        for (CostRecommendation rec : recs) {
            assertEquals(CostRecommendation.annualize(rec.getMonthlySavings()), rec.getAnnualSavings());
        }
    }

    @Test
    void allEmptySourcesGiveEmptyFullServiceResult() {
        AggregationResult result = service(settings().build(),
                cohClient(List::of), ceClient(List::of), spClient(List::of)).run();

        assertTrue(result.getRecommendations().isEmpty());
        assertEquals(0, result.getExecutiveSummary().getTotalRecommendations());
        assertEquals(0.0, result.getExecutiveSummary().getTotalMonthlySavings());
        assertEquals(DegradationStatus.FULL_SERVICE, result.getGracefulDegradationInfo().getStatus());
        assertTrue(result.getErrorMessages().isEmpty());
        assertEquals(1.0, result.getDataQualitySummary().getQualityScore());
    }

    @Test
    void heldResultIsReturnedUntilRefresh() {
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0)));
        CostOptimizationService service = service(settings().build(), coh, ceClient(List::of), spClient(List::of));

        AggregationResult first = service.run();
        AggregationResult second = service.run();
        assertSame(first, second);
        assertEquals(1, coh.getCalls());

        AggregationResult refreshed = service.run(true);
        assertNotSame(first, refreshed);
        assertEquals(1, coh.getCalls(), "refresh inside the cache TTL reuses cached upstream data");

        service.clearCache();
        service.run(true);
        assertEquals(2, coh.getCalls());
    }

    @Test
    void cachedResponsesExpireAfterTtl() {
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0)));
        CostOptimizationService service = service(settings().cacheTtl(Duration.ofMinutes(30)).build(),
                coh, ceClient(List::of), spClient(List::of));

        service.run();
        clock.advance(Duration.ofMinutes(31));
        service.run(true);

        assertEquals(2, coh.getCalls());
    }

    @Test
    void failedRunIsNotHeld() {
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> {
            throw new TerminalSourceException(RecommendationSource.COH, "AccessDeniedException", "denied");
        });
        CostOptimizationService service = service(settings().failureThreshold(10).build(), coh,
                ceClient(() -> {
                    throw new TerminalSourceException(RecommendationSource.COST_EXPLORER, "AccessDeniedException", "denied");
                }),
                spClient(() -> {
                    throw new TerminalSourceException(RecommendationSource.SAVINGS_PLANS, "AccessDeniedException", "denied");
                }));

        AggregationResult result = service.run();
        service.run();

        assertEquals(DegradationStatus.MINIMAL, result.getGracefulDegradationInfo().getStatus());
        assertTrue(result.getRecommendations().isEmpty());
        assertNotNull(result.getExecutiveSummary());
        assertEquals(2, coh.getCalls());
    }

    @Test
    void circuitOpensAfterRepeatedFailures() {
        FakeSourceClient<SavingsPlansRawRecommendation> sp = spClient(() -> {
            throw new TerminalSourceException(RecommendationSource.SAVINGS_PLANS, "AccessDeniedException", "denied");
        });
        CostOptimizationService service = service(settings().failureThreshold(2).build(),
                cohClient(List::of), ceClient(List::of), sp);

        service.run(true);
        service.run(true);
        AggregationResult third = service.run(true);

        assertEquals(2, sp.getCalls());
        assertTrue(third.getErrorMessages().contains("Savings Plans temporarily unavailable (circuit breaker open)"));
        Map<String, CircuitState> states = service.getCircuitStates();
        assertEquals(List.of("coh", "cost_explorer", "savings_plans"), new ArrayList<>(states.keySet()));
        assertEquals(CircuitBreaker.State.OPEN, states.get("savings_plans").getState());
        assertEquals(CircuitBreaker.State.CLOSED, states.get("coh").getState());
        assertEquals(CircuitBreaker.State.OPEN,
                third.getGracefulDegradationInfo().getCircuitStates().get("savings_plans").getState());
    }

    @Test
    void transientFailuresAreRetried() {
        AtomicInteger attempts = new AtomicInteger();
        FakeSourceClient<SavingsPlansRawRecommendation> sp = spClient(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientSourceException(RecommendationSource.SAVINGS_PLANS, "ThrottlingException", "slow down");
            }
            return List.of(SavingsPlansRawRecommendation.builder()
                    .recommendationDetailId("d1").savingsPlansType("COMPUTE_SP").termInYears("ONE_YEAR")
                    .estimatedMonthlySavings(75.0).build());
        });

        AggregationResult result = service(settings().build(), cohClient(List::of), ceClient(List::of), sp).run();

        assertEquals(3, sp.getCalls());
        assertEquals(DegradationStatus.FULL_SERVICE, result.getGracefulDegradationInfo().getStatus());
        assertEquals("sp-d1", result.getRecommendations().get(0).getId());
    }

    @Test
    void slowSourceIsAbandonedAtDeadline() {
        CountDownLatch never = new CountDownLatch(1);
        FakeSourceClient<RightsizingRawRecommendation> slow = ceClient(() -> {
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(rightsizingRaw("i-late", 10.0));
        });
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0)));

        AggregationResult result = service(settings().sourceTimeout(Duration.ofSeconds(1)).build(),
                coh, slow, spClient(List::of)).run();

        assertEquals(List.of(RecommendationSource.COST_EXPLORER), result.getGracefulDegradationInfo().getFailedSources());
        assertTrue(result.getErrorMessages().contains("Cost Explorer timed out after 1s and was abandoned"));
        assertEquals(1, result.getRecommendations().size());
    }

    @Test
    void skippedRecordsAreReportedAsErrors() {
        FakeSourceClient<CohRawRecommendation> coh = cohClient(() -> List.of(
                cohRaw("a1", "i-a", 100.0), CohRawRecommendation.builder().resourceId("i-z").build()));

        AggregationResult result = service(settings().build(), coh, ceClient(List::of), spClient(List::of)).run();

        assertEquals(1, result.getRecommendations().size());
        assertEquals(1, result.getErrorMessages().size());
        assertTrue(result.getErrorMessages().get(0).contains("missing recommendation id"));
    }

    @Test
    void postProcessingFailureFallsBackToEmptyResult() {
        RecommendationPipeline failing = mock(RecommendationPipeline.class);
        when(failing.process(any(), any(Instant.class))).thenThrow(new IllegalStateException("scorer exploded"));
        CostOptimizationService service = new CostOptimizationService(
                clients(cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0))), ceClient(List::of), spClient(List::of)),
                new RecommendationNormalizer(clock), failing, monitor, new CrossReferenceEngine(),
                settings().build(), executor, d -> { }, objectMapper, clock);

        AggregationResult result = service.run();

        assertTrue(result.getRecommendations().isEmpty());
        assertNotNull(result.getExecutiveSummary());
        assertEquals(0, result.getExecutiveSummary().getTotalRecommendations());
        assertTrue(result.getErrorMessages().stream().anyMatch(m -> m.contains("scorer exploded")));
        assertFalse(result.getAnomalies().isAnalyzed());
    }

    @Test
    void resultOfFailedAssemblyIsNotHeld() {
        DataQualityMonitor failingMonitor = mock(DataQualityMonitor.class);
        when(failingMonitor.assess(any(), anyInt(), anyInt(), anyInt()))
                .thenThrow(new IllegalStateException("quality assessment failed"))
                .thenReturn(DataQuality.builder().build());
        RecommendationPipeline pipelineWithFailingMonitor = new RecommendationPipeline(new RecommendationDeduplicator(),
                new PriorityScorer(), new DataQualityValidator(), new AnomalyDetector(), new ExecutiveSummaryGenerator(),
                failingMonitor);
        CostOptimizationService service = new CostOptimizationService(
                clients(cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0))), ceClient(List::of), spClient(List::of)),
                new RecommendationNormalizer(clock), pipelineWithFailingMonitor, failingMonitor, new CrossReferenceEngine(),
                settings().build(), executor, d -> { }, objectMapper, clock);

        AggregationResult failed = service.run();

        assertTrue(failed.getRecommendations().isEmpty());
        assertTrue(failed.getErrorMessages().contains("Aggregation failed unexpectedly: quality assessment failed"));
        AggregationResult next = service.run();
        assertNotSame(failed, next);
        assertEquals(1, next.getRecommendations().size());
        assertSame(next, service.run());
    }

    @Test
    void serializesResultWithSnakeCaseNames() {
        CostOptimizationService service = service(settings().build(),
                cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0))), ceClient(List::of), spClient(List::of));

        String json = service.getResultAsJson();

        assertTrue(json.contains("\"executive_summary\""));
        assertTrue(json.contains("\"graceful_degradation_info\""));
        assertTrue(json.contains("\"monthly_savings\":100.0"));
        assertTrue(json.contains("\"source\":\"coh\""));
    }

    @Test
    void crossReferencesHeldRecommendations() {
        CostOptimizationService service = service(settings().build(),
                cohClient(() -> List.of(cohRaw("a1", "i-a", 100.0))), ceClient(List::of), spClient(List::of));
        service.run();

        CrossReferenceReport report = service.crossReference(Map.of("securityhub", List.of(
                SecurityFinding.builder().id("f1").resourceId("i-a").severity(Severity.HIGH).build())));

        assertEquals(1, report.getIntegratedRecommendations().size());
        assertEquals("integrated_coh-a1", report.getIntegratedRecommendations().get(0).getRecommendationId());
    }

    private CostOptimizationService service(AggregationSettings settings, RecommendationSourceClient<?>... sources) {
        return new CostOptimizationService(clients(sources), new RecommendationNormalizer(clock), pipeline, monitor,
                new CrossReferenceEngine(), settings, executor, d -> { }, objectMapper, clock);
    }

    @SuppressWarnings("unchecked")
    private static List<RecommendationSourceClient<? extends RawRecommendation>> clients(RecommendationSourceClient<?>... sources) {
        List<RecommendationSourceClient<? extends RawRecommendation>> list = new ArrayList<>();
        for (RecommendationSourceClient<?> source : sources) {
            list.add((RecommendationSourceClient<? extends RawRecommendation>) source);
        }
        return list;
    }

    private static AggregationSettings.AggregationSettingsBuilder settings() {
        return AggregationSettings.builder()
                .maxRetries(3)
                .baseDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO);
    }

    private static FakeSourceClient<CohRawRecommendation> cohClient(Supplier<List<CohRawRecommendation>> response) {
        return new FakeSourceClient<>(RecommendationSource.COH, response);
    }

    private static FakeSourceClient<RightsizingRawRecommendation> ceClient(Supplier<List<RightsizingRawRecommendation>> response) {
        return new FakeSourceClient<>(RecommendationSource.COST_EXPLORER, response);
    }

    private static FakeSourceClient<SavingsPlansRawRecommendation> spClient(Supplier<List<SavingsPlansRawRecommendation>> response) {
        return new FakeSourceClient<>(RecommendationSource.SAVINGS_PLANS, response);
    }

    private static CohRawRecommendation cohRaw(String id, String resourceId, double savings) {
        return CohRawRecommendation.builder()
                .recommendationId(id)
                .resourceId(resourceId)
                .region("us-east-1")
                .currentResourceType("Ec2Instance")
                .actionType("Rightsize")
                .recommendedResourceType("t3.small")
                .implementationEffort("Low")
                .estimatedMonthlySavings(savings)
                .estimatedMonthlyCost(savings * 2)
                .build();
    }

    private static RightsizingRawRecommendation rightsizingRaw(String resourceId, double savings) {
        return RightsizingRawRecommendation.builder()
                .resourceId(resourceId)
                .rightsizingType("TERMINATE")
                .currentMonthlyCost(savings)
                .estimatedMonthlySavings(savings)
                .build();
    }
}
