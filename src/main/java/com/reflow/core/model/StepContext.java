package com.reflow.core.model;

import com.reflow.core.budget.BudgetSnapshot;

import java.util.Map;

/**
 * Immutable description of one attempt of one step, as seen before the call.
 *
 * @param taskId       owning task
 * @param stepIndex    zero-based step index
 * @param stepName     step name
 * @param toolName     tool invoked
 * @param params       call parameters
 * @param attempt      zero-based attempt index at this step
 * @param preStateHash world-state hash before the call
 * @param budget       remaining budget when the attempt was admitted
 */
public record StepContext(
        String taskId,
        int stepIndex,
        String stepName,
        String toolName,
        Map<String, Object> params,
        int attempt,
        String preStateHash,
        BudgetSnapshot budget
) {

    public StepContext {
        params = params == null ? Map.of() : params;
    }
}
