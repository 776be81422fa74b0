package com.reflow.core.recovery;

import com.reflow.core.diagnosis.DiagnosisRequest;
import com.reflow.core.memory.FaultSignature;
import com.reflow.core.model.StepContext;
import com.reflow.core.model.StepResult;

import java.util.List;

/**
 * Everything a strategy may look at when deciding. The injected-fault descriptor on
 * {@link #result()} is ground truth and strategies must not consult it.
 *
 * @param step            context of the failed attempt
 * @param result          the failed result
 * @param signature       canonical signature of the failure
 * @param postAttemptHash world-state hash right after the failed attempt
 * @param failuresAtStep  failed attempts at this step so far, this one included
 * @param retriesAtStep   plain retries already executed at this step
 * @param rollbacksAtStep rollbacks already executed at this step
 * @param recentHistory   latest attempts of the task, oldest first
 * @param allowance       token admission for collaborator calls
 */
public record FailureContext(
        StepContext step,
        StepResult result,
        FaultSignature signature,
        String postAttemptHash,
        int failuresAtStep,
        int retriesAtStep,
        int rollbacksAtStep,
        List<DiagnosisRequest.HistoryEntry> recentHistory,
        TokenAllowance allowance
) {

    public FailureContext {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
        allowance = allowance == null ? tokens -> true : allowance;
    }

    public String errorKind() {
        return result.errorKind();
    }

    /**
     * Admits and charges the token cost of a collaborator call against the task budget.
     */
    @FunctionalInterface
    public interface TokenAllowance {
        boolean tryConsume(int tokens);
    }
}
