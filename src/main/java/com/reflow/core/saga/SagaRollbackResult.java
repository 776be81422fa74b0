package com.reflow.core.saga;

import java.util.List;

/**
 * Outcome of unwinding the Saga stack.
 *
 * @param compensated frames whose compensation succeeded, in invocation order
 * @param failedFrame the frame whose compensation failed, or null when the unwind completed
 * @param reason      failure reason, or null
 * @param pending     frames left on the stack after a halt, top first
 */
public record SagaRollbackResult(
        List<SagaFrame> compensated,
        SagaFrame failedFrame,
        String reason,
        List<SagaFrame> pending
) {

    public boolean completed() {
        return failedFrame == null;
    }
}
