package com.reflow.core.recovery;

import java.time.Duration;

/**
 * Bounded retry-delay state machine: each {@link #nextDelay()} advances the attempt counter.
 * Delays grow by {@code multiplier} per attempt and stop growing after {@code maxGrowthSteps}.
 */
public final class RetryBackoff {

    private final Duration base;
    private final int multiplier;
    private final int maxGrowthSteps;
    private int attempts;

    private RetryBackoff(Duration base, int multiplier, int maxGrowthSteps) {
        if (base.isNegative()) {
            throw new IllegalArgumentException("Backoff base must not be negative");
        }
        this.base = base;
        this.multiplier = multiplier;
        this.maxGrowthSteps = Math.max(0, maxGrowthSteps);
    }

    /** base, 2·base, 4·base, ... capped after {@code maxRetries - 1} doublings. */
    public static RetryBackoff exponential(Duration base, int maxRetries) {
        return new RetryBackoff(base, 2, maxRetries - 1);
    }

    public static RetryBackoff fixed(Duration delay) {
        return new RetryBackoff(delay, 1, 0);
    }

    public Duration nextDelay() {
        int exponent = Math.min(attempts, maxGrowthSteps);
        attempts++;
        long factor = 1;
        for (int i = 0; i < exponent; i++) {
            factor *= multiplier;
        }
        return base.multipliedBy(factor);
    }

    public int attempts() {
        return attempts;
    }

    public void reset() {
        attempts = 0;
    }
}
