package com.xammer.costhub.service.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CircuitState {
    private CircuitBreaker.State state;

    @JsonProperty("failure_count")
    private int failureCount;

    @JsonProperty("last_failure_time")
    private Instant lastFailureTime;
}
