package com.xammer.costhub.config;

import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.service.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class AggregationConfig {

    @Value("${costhub.regions:us-east-1}")
    private List<String> regions;

    @Value("${costhub.max-results:1000}")
    private int maxResults;

    @Value("${costhub.filters.implementation-efforts:}")
    private List<String> implementationEfforts;

    @Value("${costhub.filters.restart-needed:#{null}}")
    private Boolean restartNeeded;

    @Value("${costhub.source-timeout-seconds:120}")
    private long sourceTimeoutSeconds;

    @Value("${costhub.circuit-breaker.failure-threshold:3}")
    private int failureThreshold;

    @Value("${costhub.circuit-breaker.recovery-timeout-seconds:300}")
    private long recoveryTimeoutSeconds;

    @Value("${costhub.retry.max-retries:3}")
    private int maxRetries;

    @Value("${costhub.retry.base-delay-millis:1000}")
    private long baseDelayMillis;

    @Value("${costhub.retry.max-delay-millis:60000}")
    private long maxDelayMillis;

    @Value("${costhub.cache.ttl-minutes:30}")
    private long cacheTtlMinutes;

    @Bean
    public AggregationSettings aggregationSettings() {
        List<String> efforts = new ArrayList<>();
        for (String effort : implementationEfforts) {
            if (!effort.isBlank()) {
                efforts.add(effort.trim());
            }
        }
        return AggregationSettings.builder()
                .regions(new ArrayList<>(regions))
                .maxResults(maxResults)
                .filters(FetchFilters.builder()
                        .implementationEfforts(efforts)
                        .restartNeeded(restartNeeded)
                        .build())
                .sourceTimeout(Duration.ofSeconds(sourceTimeoutSeconds))
                .failureThreshold(failureThreshold)
                .recoveryTimeout(Duration.ofSeconds(recoveryTimeoutSeconds))
                .maxRetries(maxRetries)
                .baseDelay(Duration.ofMillis(baseDelayMillis))
                .maxDelay(Duration.ofMillis(maxDelayMillis))
                .cacheTtl(Duration.ofMinutes(cacheTtlMinutes))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy.Sleeper retrySleeper() {
        return RetryPolicy.THREAD_SLEEPER;
    }
}
