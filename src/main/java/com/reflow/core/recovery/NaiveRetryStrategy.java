package com.reflow.core.recovery;

import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;

import java.time.Duration;

/**
 * Baseline B1: retry whatever failed with a fixed pause, then give up.
 */
public class NaiveRetryStrategy implements RecoveryStrategy {

    private final int maxRetries;
    private final Duration delay;

    public NaiveRetryStrategy(int maxRetries, Duration delay) {
        this.maxRetries = maxRetries;
        this.delay = delay;
    }

    @Override
    public StrategyType type() {
        return StrategyType.NAIVE_RETRY;
    }

    @Override
    public RecoveryDecision decide(FailureContext failure) {
        if (failure.retriesAtStep() < maxRetries) {
            return RecoveryDecision.of(RecoveryAction.RETRY, DecisionSource.BASELINE, "naive_retry");
        }
        return RecoveryDecision.of(RecoveryAction.ABORT, DecisionSource.BASELINE, "retries_exhausted");
    }

    @Override
    public RetryBackoff newBackoff() {
        return RetryBackoff.fixed(delay);
    }
}
