package com.reflow.core.recovery;

import com.reflow.core.diagnosis.DiagnosisResponse;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;

/**
 * What the policy decided for one failed attempt.
 *
 * @param action     chosen action
 * @param confidence decision confidence in [0, 1]
 * @param source     who decided
 * @param diagnosis  diagnosis payload when a collaborator was consulted, else null
 * @param tokensUsed tokens charged for the decision
 * @param rationale  short machine-readable reason
 * @param matchedKey memory entry key on a memory hit, else null
 */
public record RecoveryDecision(
        RecoveryAction action,
        double confidence,
        DecisionSource source,
        DiagnosisResponse diagnosis,
        int tokensUsed,
        String rationale,
        String matchedKey
) {

    public static RecoveryDecision of(RecoveryAction action, DecisionSource source, String rationale) {
        return new RecoveryDecision(action, 1.0, source, null, 0, rationale, null);
    }

    /** Same decision with a different action and reason, e.g. when a ceiling overrides a retry. */
    public RecoveryDecision overriddenBy(RecoveryAction newAction, DecisionSource newSource, String newRationale) {
        return new RecoveryDecision(newAction, confidence, newSource, diagnosis, tokensUsed, newRationale, matchedKey);
    }

    /** Whether the outcome of this decision is worth learning from. */
    public boolean learnable() {
        return source == DecisionSource.DIAGNOSIS || source == DecisionSource.MEMORY;
    }
}
