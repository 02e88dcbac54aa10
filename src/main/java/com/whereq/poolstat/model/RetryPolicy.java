package com.whereq.poolstat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry policy for queries against a single pool source
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Maximum number of attempts, including the first one
     */
    @Builder.Default
    private int maxRetries = 4;

    /**
     * Fixed delay between attempts
     */
    @Builder.Default
    private Duration delay = Duration.ofSeconds(30);

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Number of re-subscriptions after the first attempt
     */
    public long retriesAfterFirstAttempt() {
        return Math.max(0, maxRetries - 1);
    }
}
