package com.reflow.core.model;

/**
 * Action chosen by the recovery policy for a failed attempt.
 */
public enum RecoveryAction {
    /** Re-attempt the same step after the backoff delay. */
    RETRY,
    /** Restore the pre-step checkpoint, then re-attempt. */
    ROLLBACK_THEN_RETRY,
    /** Unwind the Saga stack, then halt with a ticket. */
    COMPENSATE_THEN_ESCALATE,
    /** Halt with a ticket after unwinding pending compensations. */
    ESCALATE,
    /** Stop as failed without recovery or ticket. Used by baselines only. */
    ABORT;

    public boolean retries() {
        return this == RETRY || this == ROLLBACK_THEN_RETRY;
    }

    public boolean escalates() {
        return this == ESCALATE || this == COMPENSATE_THEN_ESCALATE;
    }
}
