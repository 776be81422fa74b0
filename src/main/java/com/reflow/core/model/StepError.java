package com.reflow.core.model;

/**
 * Structured error of a failed call.
 *
 * @param kind    error kind: a {@link FaultKind} wire name, {@value #POST_CONDITION_VIOLATED} or {@value #TOOL_ERROR}
 * @param message human-readable message
 * @param trace   short origin description, may be null
 */
public record StepError(String kind, String message, String trace) {

    public static final String POST_CONDITION_VIOLATED = "PostConditionViolated";
    public static final String TOOL_ERROR = "ToolError";

    public static StepError of(FaultKind kind) {
        return new StepError(kind.wireName(), kind.message(), "injected");
    }
}
