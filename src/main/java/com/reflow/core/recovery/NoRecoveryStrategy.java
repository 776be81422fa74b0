package com.reflow.core.recovery;

import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;

import java.time.Duration;

/**
 * Baseline B0: the first failure ends the task.
 */
public class NoRecoveryStrategy implements RecoveryStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.NO_RECOVERY;
    }

    @Override
    public RecoveryDecision decide(FailureContext failure) {
        return RecoveryDecision.of(RecoveryAction.ABORT, DecisionSource.BASELINE, "no_recovery");
    }

    @Override
    public RetryBackoff newBackoff() {
        return RetryBackoff.fixed(Duration.ZERO);
    }
}
