package com.reflow.core.diagnosis;

import com.reflow.core.model.StepContext;
import com.reflow.core.model.StepError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a diagnosis collaborator sees: the failed attempt, recent history and retry count.
 * Injected-fault descriptors are never part of a request.
 *
 * @param step          context of the failed attempt
 * @param error         structured error
 * @param recentHistory most recent attempts of the task, oldest first
 * @param retryCount    failed attempts so far at this step, this one included
 */
public record DiagnosisRequest(
        StepContext step,
        StepError error,
        List<HistoryEntry> recentHistory,
        int retryCount
) {

    public DiagnosisRequest {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }

    /**
     * One earlier attempt as shown to the collaborator.
     */
    public record HistoryEntry(String step, String status, String error) {}

    /** Flat JSON-ready view used as the prompt input. */
    public Map<String, Object> toPromptPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_type", error.kind());
        payload.put("error_msg", error.message());
        payload.put("step_name", step.stepName());
        payload.put("tool_name", step.toolName());
        payload.put("recent_history", recentHistory);
        payload.put("retry_count", retryCount);
        payload.put("state_hash", step.preStateHash());
        return payload;
    }
}
