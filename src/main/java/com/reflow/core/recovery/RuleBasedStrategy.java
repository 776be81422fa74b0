package com.reflow.core.recovery;

import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;

import java.time.Duration;

/**
 * B2: a fixed layer → action table.
 * <ul>
 *   <li>transient: retry with exponential backoff, up to {@code maxRetries}</li>
 *   <li>persistent and conflict-like: one rollback-then-retry</li>
 *   <li>other persistent, semantic: escalate</li>
 *   <li>cascade: compensate, then escalate</li>
 * </ul>
 */
public class RuleBasedStrategy implements RecoveryStrategy {

    private static final int CONFLICT_ROLLBACKS = 1;

    private final int maxRetries;
    private final Duration baseDelay;

    public RuleBasedStrategy(int maxRetries, Duration baseDelay) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
    }

    @Override
    public StrategyType type() {
        return StrategyType.RULE_BASED;
    }

    @Override
    public RecoveryDecision decide(FailureContext failure) {
        String kind = failure.errorKind();
        FaultLayer layer = FaultClassifier.classify(kind);
        return switch (layer) {
            case TRANSIENT -> failure.retriesAtStep() < maxRetries
                    ? RecoveryDecision.of(RecoveryAction.RETRY, DecisionSource.RULE, "transient:" + kind)
                    : RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.RULE, "transient_retries_exhausted:" + kind);
            case PERSISTENT -> {
                if (FaultClassifier.isConflictLike(kind) && failure.rollbacksAtStep() < CONFLICT_ROLLBACKS) {
                    yield RecoveryDecision.of(RecoveryAction.ROLLBACK_THEN_RETRY, DecisionSource.RULE, "conflict:" + kind);
                }
                yield RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.RULE, "persistent:" + kind);
            }
            case SEMANTIC -> RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.RULE, "semantic:" + kind);
            case CASCADE -> RecoveryDecision.of(RecoveryAction.COMPENSATE_THEN_ESCALATE, DecisionSource.RULE, "cascade:" + kind);
        };
    }

    @Override
    public RetryBackoff newBackoff() {
        return RetryBackoff.exponential(baseDelay, maxRetries);
    }
}
