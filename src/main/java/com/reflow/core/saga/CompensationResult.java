package com.reflow.core.saga;

/**
 * Result of invoking one compensating call.
 */
public record CompensationResult(boolean succeeded, String reason) {

    public static CompensationResult success() {
        return new CompensationResult(true, null);
    }

    public static CompensationResult failed(String reason) {
        return new CompensationResult(false, reason);
    }
}
