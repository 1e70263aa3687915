package com.xammer.costhub.config;

import com.xammer.costhub.dto.FetchFilters;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for one orchestrator instance, bound from {@code costhub.*} properties.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationSettings {
    @Builder.Default
    private List<String> regions = new ArrayList<>(List.of("us-east-1"));
    @Builder.Default
    private int maxResults = 1000;
    @Builder.Default
    private FetchFilters filters = FetchFilters.none();
    @Builder.Default
    private Duration sourceTimeout = Duration.ofSeconds(120);

    @Builder.Default
    private int failureThreshold = 3;
    @Builder.Default
    private Duration recoveryTimeout = Duration.ofMinutes(5);
    @Builder.Default
    private int maxRetries = 3;
    @Builder.Default
    private Duration baseDelay = Duration.ofSeconds(1);
    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    private Duration cacheTtl = Duration.ofMinutes(30);
}
