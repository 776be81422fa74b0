package com.reflow.core.recovery;

import com.reflow.core.memory.FaultSignature;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;

/**
 * One interchangeable recovery policy.
 */
public interface RecoveryStrategy {

    StrategyType type();

    RecoveryDecision decide(FailureContext failure);

    /** Fresh delay schedule for retries at one step. */
    RetryBackoff newBackoff();

    /**
     * Outcome of a decision this strategy made, reported once the task has finished.
     *
     * @param success whether the step the decision was made for eventually completed
     */
    default void onOutcome(FaultSignature signature, RecoveryAction action, boolean success) {
    }
}
