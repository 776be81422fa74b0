package com.reflow.core.recovery;

import com.reflow.core.budget.LoopGuard;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps one strategy with the cross-cutting overrides, in order: the loop guard, then the
 * strategy, then the per-step attempt ceiling.
 */
public class RecoveryPolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryPolicyEngine.class);

    private final RecoveryStrategy strategy;
    private final int maxAttemptsPerStep;

    public RecoveryPolicyEngine(RecoveryStrategy strategy, int maxAttemptsPerStep) {
        this.strategy = strategy;
        this.maxAttemptsPerStep = maxAttemptsPerStep;
    }

    public RecoveryStrategy strategy() {
        return strategy;
    }

    public RecoveryDecision decide(FailureContext failure, LoopGuard loopGuard) {
        int stepIndex = failure.step().stepIndex();
        if (loopGuard.isStalled(stepIndex)) {
            log.info("No progress at step {} after {} failures; escalating", stepIndex, failure.failuresAtStep());
            return RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.GUARD, "no_progress");
        }

        RecoveryDecision decision = strategy.decide(failure);

        if (decision.action().retries() && failure.failuresAtStep() >= maxAttemptsPerStep) {
            log.info("Step {} reached {} attempts; escalating instead of {}",
                    stepIndex, maxAttemptsPerStep, decision.action());
            return decision.overriddenBy(RecoveryAction.ESCALATE, DecisionSource.GUARD, "attempt_ceiling");
        }
        return decision;
    }
}
