package com.healthecon.llm.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable retry and timeout settings for the reasoning client adapter.
 */
@Value
@Builder
public class RetryPolicy {
    
    @Builder.Default
    int maxAttempts = 3;
    
    @Builder.Default
    Duration baseDelay = Duration.ofMillis(500);
    
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(8);
    
    @Builder.Default
    Duration jitter = Duration.ofMillis(250);
    
    @Builder.Default
    Duration attemptTimeout = Duration.ofSeconds(60);
    
    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration jitter, Duration attemptTimeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.attemptTimeout = attemptTimeout;
    }
    
    /**
     * Delay before the attempt following {@code failedAttempt} (1-based):
     * {@code min(baseDelay * 2^(failedAttempt-1), maxDelay) + jitterSample}.
     */
    public long backoffMillis(int failedAttempt, long jitterSample) {
        long base = baseDelay.toMillis();
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long exponential = Math.min(base << shift, maxDelay.toMillis());
        return Math.max(exponential, 0) + Math.max(jitterSample, 0);
    }
}
