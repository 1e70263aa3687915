package com.xammer.costhub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.costhub.config.AggregationSettings;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.domain.SecurityFinding;
import com.xammer.costhub.dto.AggregationResult;
import com.xammer.costhub.dto.AnomalyReport;
import com.xammer.costhub.dto.CrossReferenceReport;
import com.xammer.costhub.dto.DegradationInfo;
import com.xammer.costhub.dto.DegradationStatus;
import com.xammer.costhub.dto.ExecutiveSummary;
import com.xammer.costhub.dto.MonitoringReport;
import com.xammer.costhub.dto.NormalizationResult;
import com.xammer.costhub.dto.SkipReason;
import com.xammer.costhub.dto.ValidationReport;
import com.xammer.costhub.dto.raw.RawRecommendation;
import com.xammer.costhub.exception.CircuitOpenException;
import com.xammer.costhub.exception.OrchestrationException;
import com.xammer.costhub.exception.SourceException;
import com.xammer.costhub.service.resilience.CircuitBreaker;
import com.xammer.costhub.service.resilience.CircuitState;
import com.xammer.costhub.service.resilience.ResilienceWrapper;
import com.xammer.costhub.service.resilience.RetryPolicy;
import com.xammer.costhub.service.resilience.TtlCache;
import com.xammer.costhub.service.source.AwsErrorClassifier;
import com.xammer.costhub.service.source.RecommendationSourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Aggregation orchestrator. Fetches every source in parallel under its own circuit breaker and retry
 * policy, normalizes, runs the {@link RecommendationPipeline} and degrades gracefully when sources fail.
 * <p>
 * Circuit breakers and the response cache live as long as this instance. {@link #run(boolean)} never
 * throws; every failure ends up in {@code error_messages} of a well-formed result.
 */
@Service
public class CostOptimizationService {

    private static final Logger logger = LoggerFactory.getLogger(CostOptimizationService.class);

    private final List<RecommendationSourceClient<? extends RawRecommendation>> sourceClients;
    private final Map<RecommendationSource, ResilienceWrapper> resilienceWrappers = new EnumMap<>(RecommendationSource.class);
    private final TtlCache<List<? extends RawRecommendation>> responseCache;
    private final RecommendationNormalizer normalizer;
    private final RecommendationPipeline pipeline;
    private final DataQualityMonitor monitor;
    private final CrossReferenceEngine crossReferenceEngine;
    private final AggregationSettings settings;
    private final Executor sourceExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private volatile AggregationResult lastResult;
    private volatile boolean lastRunSuccessful;

    public CostOptimizationService(List<RecommendationSourceClient<? extends RawRecommendation>> sourceClients,
                                   RecommendationNormalizer normalizer,
                                   RecommendationPipeline pipeline,
                                   DataQualityMonitor monitor,
                                   CrossReferenceEngine crossReferenceEngine,
                                   AggregationSettings settings,
                                   @Qualifier("sourceTaskExecutor") Executor sourceExecutor,
                                   RetryPolicy.Sleeper retrySleeper,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        this.sourceClients = sourceClients.stream()
                .sorted(Comparator.comparing(client -> client.getSource().ordinal()))
                .collect(Collectors.toList());
        this.normalizer = normalizer;
        this.pipeline = pipeline;
        this.monitor = monitor;
        this.crossReferenceEngine = crossReferenceEngine;
        this.settings = settings;
        this.sourceExecutor = sourceExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.responseCache = new TtlCache<>(settings.getCacheTtl(), clock);

        for (RecommendationSourceClient<? extends RawRecommendation> client : this.sourceClients) {
            RecommendationSource source = client.getSource();
            CircuitBreaker breaker = new CircuitBreaker(source.getWireName(), settings.getFailureThreshold(),
                    settings.getRecoveryTimeout(), clock);
            RetryPolicy retryPolicy = new RetryPolicy(AwsErrorClassifier::isRetryable, settings.getMaxRetries(),
                    settings.getBaseDelay(), settings.getMaxDelay(), retrySleeper);
            resilienceWrappers.put(source, new ResilienceWrapper(breaker, retryPolicy));
        }
        logger.info("CostOptimizationService initialized with sources {}",
                this.sourceClients.stream().map(c -> c.getSource().getWireName()).collect(Collectors.toList()));
    }

    public AggregationResult run() {
        return run(false);
    }

    /**
     * Returns the held result when the previous run succeeded and no refresh is requested; otherwise
     * collects again. Concurrent callers are serialized.
     */
    public AggregationResult run(boolean forceRefresh) {
        runLock.lock();
        try {
            if (!forceRefresh && lastRunSuccessful && lastResult != null) {
                logger.debug("--- RETURNING HELD AGGREGATION RESULT FROM {} ---", lastResult.getDataCollectionTime());
                return lastResult;
            }
            lastRunSuccessful = false;
            AggregationResult result;
            try {
                RunOutcome outcome = collectAndProcess();
                result = outcome.result;
                lastRunSuccessful = outcome.successful;
            } catch (RuntimeException e) {
                logger.error("Aggregation run failed unexpectedly", e);
                result = fallbackResult(clock.instant(), new ArrayList<>(List.of(
                        "Aggregation failed unexpectedly: " + e.getMessage())), emptyDegradation());
            }
            lastResult = result;
            return result;
        } finally {
            runLock.unlock();
        }
    }

    @Async("aggregationTaskExecutor")
    public CompletableFuture<AggregationResult> runAsync(boolean forceRefresh) {
        return CompletableFuture.completedFuture(run(forceRefresh));
    }

    public AggregationResult getResultForDisplay() {
        AggregationResult result = lastResult;
        return result != null ? result : run(false);
    }

    public String getResultAsJson() {
        try {
            return objectMapper.writeValueAsString(getResultForDisplay());
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize aggregation result", e);
            throw new IllegalStateException("Failed to serialize aggregation result: " + e.getOriginalMessage(), e);
        }
    }

    public CrossReferenceReport crossReference(Map<String, List<SecurityFinding>> findingsByService) {
        return crossReferenceEngine.crossReference(getResultForDisplay().getRecommendations(), findingsByService);
    }

    public void clearCache() {
        responseCache.invalidateAll();
    }

    public Map<String, CircuitState> getCircuitStates() {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        resilienceWrappers.forEach((source, wrapper) ->
                states.put(source.getWireName(), wrapper.getCircuitBreaker().snapshot()));
        return states;
    }

    private RunOutcome collectAndProcess() {
        Instant collectedAt = clock.instant();
        logger.info("--- STARTING COST OPTIMIZATION AGGREGATION ACROSS {} SOURCES ---", sourceClients.size());

        Map<RecommendationSource, List<NormalizationResult>> completed = new EnumMap<>(RecommendationSource.class);
        Map<RecommendationSource, String> failures = new EnumMap<>(RecommendationSource.class);
        collectSources(completed, failures);

        List<String> errorMessages = new ArrayList<>();
        List<CostRecommendation> collected = new ArrayList<>();
        List<RecommendationSource> available = new ArrayList<>();
        for (RecommendationSourceClient<? extends RawRecommendation> client : sourceClients) {
            RecommendationSource source = client.getSource();
            if (failures.containsKey(source)) {
                errorMessages.add(failures.get(source));
                continue;
            }
            available.add(source);
            for (NormalizationResult normalized : completed.getOrDefault(source, List.of())) {
                normalized.getRecommendation().ifPresent(collected::add);
                normalized.getSkipReason().map(SkipReason::toString).ifPresent(errorMessages::add);
            }
        }

        DegradationInfo degradation = degradationInfo(available, new ArrayList<>(failures.keySet()));
        if (degradation.getStatus() != DegradationStatus.FULL_SERVICE) {
            errorMessages.add(degradation.getMessage());
            logger.warn("{}", degradation.getMessage());
        }

        RecommendationPipeline.Output output;
        try {
            output = pipeline.process(collected, collectedAt);
        } catch (RuntimeException e) {
            OrchestrationException failure = new OrchestrationException("Post-processing failed: " + e.getMessage(), e);
            logger.error("Falling back to an empty result", failure);
            errorMessages.add(failure.getMessage());
            return new RunOutcome(fallbackResult(collectedAt, errorMessages, degradation), false);
        }

        degradation.setRecommendationCount(output.getRecommendations().size());
        degradation.setHasExecutiveSummary(true);

        logger.info("--- AGGREGATION COMPLETE: {} recommendations, status {} ---",
                output.getRecommendations().size(), degradation.getStatus().getWireName());
        AggregationResult result = AggregationResult.builder()
                .executiveSummary(output.getSummary())
                .recommendations(output.getRecommendations())
                .errorMessages(errorMessages)
                .dataCollectionTime(collectedAt)
                .dataQuality(monitor.assess(available, sourceClients.size(), output.getRecommendations().size(),
                        errorMessages.size()))
                .gracefulDegradationInfo(degradation)
                .dataQualitySummary(output.getValidationReport())
                .anomalies(output.getAnomalyReport())
                .monitoring(output.getMonitoring())
                .build();
        return new RunOutcome(result, !available.isEmpty());
    }

    /**
     * Runs every source on the shared executor under one deadline. Sources still running at the
     * deadline are cancelled and reported as timed out; whatever finished is kept.
     */
    private void collectSources(Map<RecommendationSource, List<NormalizationResult>> completed,
                                Map<RecommendationSource, String> failures) {
        ExecutorCompletionService<List<NormalizationResult>> completionService =
                new ExecutorCompletionService<>(sourceExecutor);
        Map<Future<List<NormalizationResult>>, RecommendationSource> pending = new HashMap<>();
        for (RecommendationSourceClient<? extends RawRecommendation> client : sourceClients) {
            try {
                pending.put(completionService.submit(() -> fetchAndNormalize(client)), client.getSource());
            } catch (RuntimeException e) {
                failures.put(client.getSource(), client.getSource().getDisplayName()
                        + " could not be scheduled: " + e.getMessage());
            }
        }

        long deadline = System.nanoTime() + settings.getSourceTimeout().toNanos();
        try {
            while (!pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                Future<List<NormalizationResult>> done = completionService.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    break;
                }
                RecommendationSource source = pending.remove(done);
                try {
                    completed.put(source, done.get());
                    logger.info("{} completed", source.getDisplayName());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failures.put(source, describeFailure(source, cause));
                    logger.warn("{} failed: {}", source.getDisplayName(), cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Aggregation interrupted while waiting for {} sources", pending.size());
        }

        pending.forEach((future, source) -> {
            future.cancel(true);
            failures.put(source, source.getDisplayName() + " timed out after "
                    + settings.getSourceTimeout().getSeconds() + "s and was abandoned");
            logger.warn("{} abandoned after the {}s deadline", source.getDisplayName(),
                    settings.getSourceTimeout().getSeconds());
        });
    }

    private List<NormalizationResult> fetchAndNormalize(RecommendationSourceClient<? extends RawRecommendation> client) {
        RecommendationSource source = client.getSource();
        String cacheKey = source.getWireName() + ":" + String.join(",", settings.getRegions()) + ":"
                + settings.getMaxResults() + ":" + settings.getFilters().cacheKey();
        List<? extends RawRecommendation> raw = responseCache.get(cacheKey).orElse(null);
        if (raw == null) {
            raw = resilienceWrappers.get(source).execute(
                    () -> client.collect(settings.getRegions(), settings.getMaxResults(), settings.getFilters()));
            responseCache.put(cacheKey, List.copyOf(raw));
        }
        return normalizer.normalizeAll(raw);
    }

    private String describeFailure(RecommendationSource source, Throwable cause) {
        if (cause instanceof CircuitOpenException) {
            return source.getDisplayName() + " temporarily unavailable (circuit breaker open)";
        }
        if (cause instanceof SourceException) {
            SourceException sourceException = (SourceException) cause;
            return source.getDisplayName() + " unavailable"
                    + (sourceException.getErrorCode() != null ? " [" + sourceException.getErrorCode() + "]" : "")
                    + ": " + sourceException.getMessage();
        }
        return source.getDisplayName() + " failed: " + cause.getMessage();
    }

    private DegradationInfo degradationInfo(List<RecommendationSource> available, List<RecommendationSource> failed) {
        int total = sourceClients.size();
        double ratio = total == 0 ? 0.0 : (double) available.size() / total;
        DegradationStatus status = DegradationStatus.fromSuccessRatio(ratio);
        String message;
        if (status == DegradationStatus.FULL_SERVICE) {
            message = "All " + total + " data sources available";
        } else {
            message = String.format("%s service: %d of %d data sources available, unavailable: %s",
                    capitalize(status.getWireName().replace('_', ' ')), available.size(), total,
                    failed.stream().map(RecommendationSource::getDisplayName).collect(Collectors.joining(", ")));
        }
        return DegradationInfo.builder()
                .status(status)
                .successRatio(Math.round(ratio * 100.0) / 100.0)
                .availableSources(available)
                .failedSources(failed)
                .message(message)
                .circuitStates(getCircuitStates())
                .build();
    }

    private DegradationInfo emptyDegradation() {
        return degradationInfo(new ArrayList<>(), sourceClients.stream()
                .map(RecommendationSourceClient::getSource).collect(Collectors.toList()));
    }

    private AggregationResult fallbackResult(Instant collectedAt, List<String> errorMessages, DegradationInfo degradation) {
        degradation.setRecommendationCount(0);
        degradation.setHasExecutiveSummary(true);
        return AggregationResult.builder()
                .executiveSummary(ExecutiveSummary.empty(collectedAt))
                .recommendations(new ArrayList<>())
                .errorMessages(errorMessages)
                .dataCollectionTime(collectedAt)
                .dataQuality(monitor.assess(degradation.getAvailableSources(), sourceClients.size(), 0,
                        errorMessages.size()))
                .gracefulDegradationInfo(degradation)
                .dataQualitySummary(ValidationReport.empty())
                .anomalies(AnomalyReport.notAnalyzed())
                .monitoring(MonitoringReport.builder().build())
                .build();
    }

    /**
     * A run is held only when the pipeline completed and at least one source answered.
     */
    private static final class RunOutcome {
        private final AggregationResult result;
        private final boolean successful;

        RunOutcome(AggregationResult result, boolean successful) {
            this.result = result;
            this.successful = successful;
        }
    }

        private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
