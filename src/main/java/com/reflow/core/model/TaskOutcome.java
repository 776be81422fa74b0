package com.reflow.core.model;

/**
 * Terminal outcome of a task.
 */
public enum TaskOutcome {
    /** Every step completed and the success predicate holds. */
    SUCCESS,
    /** Predicate false after the last step, or the run aborted without recovery. */
    FAILED,
    /** Halted with a ticket after a completed rollback/compensation. */
    ESCALATED,
    /** A compensation failed; the world may be inconsistent. */
    UNHANDLED
}
