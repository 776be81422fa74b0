package com.reflow.core.trace;

public enum TraceEventType {
    /** One attempt of a forward step. */
    TOOL_CALL,
    /** A checkpoint restore before a retry. */
    RECOVERY,
    /** One compensating call during a Saga unwind. */
    COMPENSATION,
    /** Ticket raised on escalation. */
    ESCALATION,
    /** Terminal event of a task. */
    FINAL
}
