package com.xammer.costhub.service.source;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.dto.raw.CohRawRecommendation;
import com.xammer.costhub.exception.SourceException;
import com.xammer.costhub.exception.TransientSourceException;
import com.xammer.costhub.service.AwsClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.costoptimizationhub.CostOptimizationHubClient;
import software.amazon.awssdk.services.costoptimizationhub.model.Filter;
import software.amazon.awssdk.services.costoptimizationhub.model.ListRecommendationsRequest;
import software.amazon.awssdk.services.costoptimizationhub.model.ListRecommendationsResponse;
import software.amazon.awssdk.services.costoptimizationhub.model.Recommendation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class CostOptimizationHubSourceClient implements RecommendationSourceClient<CohRawRecommendation> {

    private static final Logger logger = LoggerFactory.getLogger(CostOptimizationHubSourceClient.class);

    /** Upper bound the ListRecommendations API accepts per page. */
    static final int MAX_PAGE_SIZE = 100;

    private final Function<String, CostOptimizationHubClient> clientFactory;
    private final Executor regionExecutor;
    private final Duration regionTimeout;
    private final List<String> supportedRegions;

    @Autowired
    public CostOptimizationHubSourceClient(AwsClientProvider awsClientProvider,
                                           @Qualifier("regionFanOutExecutor") Executor regionExecutor,
                                           @Value("${costhub.coh.region-timeout-seconds:30}") long regionTimeoutSeconds,
                                           @Value("${costhub.coh.supported-regions:us-east-1}") List<String> supportedRegions) {
        this(awsClientProvider::getCostOptimizationHubClient, regionExecutor,
                Duration.ofSeconds(regionTimeoutSeconds), supportedRegions);
    }

    public CostOptimizationHubSourceClient(Function<String, CostOptimizationHubClient> clientFactory,
                                           Executor regionExecutor, Duration regionTimeout,
                                           List<String> supportedRegions) {
        this.clientFactory = clientFactory;
        this.regionExecutor = regionExecutor;
        this.regionTimeout = regionTimeout;
        this.supportedRegions = List.copyOf(supportedRegions);
    }

    @Override
    public RecommendationSource getSource() {
        return RecommendationSource.COH;
    }

    @Override
    public List<CohRawRecommendation> fetch(String region, int maxResults, FetchFilters filters) {
        CostOptimizationHubClient client = clientFactory.apply(region);
        List<CohRawRecommendation> results = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                int pageSize = Math.min(MAX_PAGE_SIZE, maxResults - results.size());
                ListRecommendationsRequest.Builder request = ListRecommendationsRequest.builder()
                        .maxResults(pageSize)
                        .nextToken(nextToken);
                Filter filter = buildFilter(filters);
                if (filter != null) {
                    request.filter(filter);
                }
                ListRecommendationsResponse response = client.listRecommendations(request.build());
                for (Recommendation item : response.items()) {
                    if (results.size() >= maxResults) {
                        break;
                    }
                    results.add(toRaw(item, region));
                }
                nextToken = response.nextToken();
            } while (nextToken != null && !nextToken.isEmpty() && results.size() < maxResults);
        } catch (RuntimeException e) {
            throw AwsErrorClassifier.classify(getSource(), e);
        }
        logger.info("Fetched {} Cost Optimization Hub recommendations from {}", results.size(), region);
        return results;
    }

    /**
     * Queries every supported region in parallel. A region that fails or times out contributes nothing;
     * only when all regions fail is the first failure propagated.
     */
    @Override
    public List<CohRawRecommendation> collect(List<String> regions, int maxResults, FetchFilters filters) {
        List<String> targets = regions == null || regions.isEmpty()
                ? supportedRegions
                : regions.stream().filter(supportedRegions::contains).distinct().collect(Collectors.toList());
        if (targets.isEmpty()) {
            logger.warn("None of the requested regions {} support Cost Optimization Hub, using {}", regions, supportedRegions);
            targets = supportedRegions;
        }

        Map<String, CompletableFuture<List<CohRawRecommendation>>> futures = targets.stream()
                .collect(Collectors.toMap(Function.identity(),
                        region -> CompletableFuture
                                .supplyAsync(() -> fetch(region, maxResults, filters), regionExecutor)
                                .orTimeout(regionTimeout.toMillis(), TimeUnit.MILLISECONDS),
                        (a, b) -> a, LinkedHashMap::new));

        List<CohRawRecommendation> all = new ArrayList<>();
        SourceException firstFailure = null;
        int failedRegions = 0;
        for (Map.Entry<String, CompletableFuture<List<CohRawRecommendation>>> entry : futures.entrySet()) {
            try {
                all.addAll(entry.getValue().join());
            } catch (CompletionException e) {
                failedRegions++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("Cost Optimization Hub region {} failed: {}", entry.getKey(), cause.getMessage());
                if (firstFailure == null) {
                    firstFailure = cause instanceof TimeoutException
                            ? new TransientSourceException(getSource(), "RegionTimeout",
                                    "Cost Optimization Hub timed out in " + entry.getKey(), cause)
                            : AwsErrorClassifier.classify(getSource(), cause);
                }
            }
        }
        if (failedRegions == futures.size() && firstFailure != null) {
            throw firstFailure;
        }
        return all.size() > maxResults ? new ArrayList<>(all.subList(0, maxResults)) : all;
    }

    private Filter buildFilter(FetchFilters filters) {
        if (filters == null || (!filters.hasImplementationEfforts() && filters.getRestartNeeded() == null)) {
            return null;
        }
        Filter.Builder builder = Filter.builder();
        if (filters.hasImplementationEfforts()) {
            builder.implementationEffortsWithStrings(filters.getImplementationEfforts());
        }
        if (filters.getRestartNeeded() != null) {
            builder.restartNeeded(filters.getRestartNeeded());
        }
        return builder.build();
    }

    private CohRawRecommendation toRaw(Recommendation item, String region) {
        return CohRawRecommendation.builder()
                .recommendationId(item.recommendationId())
                .accountId(item.accountId())
                .region(item.region() != null ? item.region() : region)
                .resourceId(item.resourceId())
                .resourceArn(item.resourceArn())
                .currentResourceType(asText(item.currentResourceType()))
                .recommendedResourceType(asText(item.recommendedResourceType()))
                .actionType(asText(item.actionType()))
                .implementationEffort(asText(item.implementationEffort()))
                .restartNeeded(item.restartNeeded())
                .rollbackPossible(item.rollbackPossible())
                .estimatedMonthlySavings(item.estimatedMonthlySavings())
                .estimatedMonthlyCost(item.estimatedMonthlyCost())
                .estimatedSavingsPercentage(item.estimatedSavingsPercentage())
                .currentResourceSummary(item.currentResourceSummary())
                .recommendedResourceSummary(item.recommendedResourceSummary())
                .upstreamSource(asText(item.source()))
                .lastRefreshTimestamp(item.lastRefreshTimestamp())
                .build();
    }

    // Some members are modelled as enums in newer SDK releases; their toString() is the wire value.
    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
