package com.reflow.core.model;

import java.util.Map;

/**
 * Outcome of one call. A failed call is a value, never an exception.
 *
 * @param status        {@link StepStatus#OK} or {@link StepStatus#ERROR}
 * @param output        tool output on success, null on error
 * @param error         structured error on failure, null on success
 * @param latencyMs     simulated latency of the call
 * @param injectedFault ground-truth fault descriptor when a fault fired (also set for a silent StaleWrite)
 * @param effectApplied the tool body ran against the live world, even if the call then reported an error
 */
public record StepResult(
        StepStatus status,
        Map<String, Object> output,
        StepError error,
        long latencyMs,
        InjectedFault injectedFault,
        boolean effectApplied
) {

    public static StepResult ok(Map<String, Object> output, long latencyMs, InjectedFault injectedFault) {
        return new StepResult(StepStatus.OK, output == null ? Map.of() : output, null, latencyMs, injectedFault, true);
    }

    public static StepResult error(StepError error, long latencyMs, InjectedFault injectedFault) {
        return new StepResult(StepStatus.ERROR, null, error, latencyMs, injectedFault, false);
    }

    /** An error reported after the tool had already written to the live world. */
    public static StepResult errorAfterEffect(StepError error, long latencyMs, InjectedFault injectedFault) {
        return new StepResult(StepStatus.ERROR, null, error, latencyMs, injectedFault, true);
    }

    public boolean isOk() {
        return status == StepStatus.OK;
    }

    public String errorKind() {
        return error != null ? error.kind() : null;
    }

    public String errorMessage() {
        return error != null ? error.message() : null;
    }
}
