package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every fault the injector can surface, with its ground-truth layer, the error message the
 * mock API reports and the simulated latency range of a faulted call.
 */
public enum FaultKind {
    TIMEOUT("Timeout", FaultLayer.TRANSIENT, FaultEffect.ERROR, "Request timeout after 30s", 50, 150),
    HTTP_500("HTTP_500", FaultLayer.TRANSIENT, FaultEffect.ERROR, "Internal server error", 30, 80),
    RATE_LIMITED("RateLimited", FaultLayer.TRANSIENT, FaultEffect.ERROR, "Rate limit exceeded, retry later", 10, 40),
    AUTH_DENIED("AuthDenied", FaultLayer.PERSISTENT, FaultEffect.ERROR, "Authentication denied", 10, 40),
    NOT_FOUND("NotFound", FaultLayer.PERSISTENT, FaultEffect.ERROR, "Resource not found", 10, 40),
    BAD_REQUEST("BadRequest", FaultLayer.PERSISTENT, FaultEffect.ERROR, "Invalid request parameters", 10, 40),
    POLICY_REJECTED("PolicyRejected", FaultLayer.PERSISTENT, FaultEffect.ERROR, "Policy violation detected", 10, 40),
    CONFLICT("Conflict", FaultLayer.PERSISTENT, FaultEffect.ERROR, "Resource conflict detected", 20, 60),
    STALE_WRITE("StaleWrite", FaultLayer.SEMANTIC, FaultEffect.LOST_WRITE, "Write acknowledged but not persisted", 10, 40),
    STATE_CORRUPTION("StateCorruption", FaultLayer.CASCADE, FaultEffect.ORPHAN_THEN_ERROR, "State corruption detected", 20, 60),
    PARTIAL_FAILURE("PartialFailure", FaultLayer.CASCADE, FaultEffect.ORPHAN_THEN_ERROR, "Partial failure: downstream write incomplete", 20, 60);

    private final String wireName;
    private final FaultLayer layer;
    private final FaultEffect effect;
    private final String message;
    private final int minLatencyMs;
    private final int maxLatencyMs;

    FaultKind(String wireName, FaultLayer layer, FaultEffect effect, String message,
              int minLatencyMs, int maxLatencyMs) {
        this.wireName = wireName;
        this.layer = layer;
        this.effect = effect;
        this.message = message;
        this.minLatencyMs = minLatencyMs;
        this.maxLatencyMs = maxLatencyMs;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public FaultLayer layer() {
        return layer;
    }

    public FaultEffect effect() {
        return effect;
    }

    public String message() {
        return message;
    }

    public int minLatencyMs() {
        return minLatencyMs;
    }

    public int maxLatencyMs() {
        return maxLatencyMs;
    }

    public boolean isConflictLike() {
        return this == CONFLICT;
    }

    @JsonCreator
    public static FaultKind fromWire(String value) {
        for (FaultKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown fault kind: " + value);
    }

    /**
     * Returns the kind whose wire name equals {@code value}, or {@code null}.
     */
    public static FaultKind lookup(String value) {
        for (FaultKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * How an injected fault manifests against the world state.
     */
    public enum FaultEffect {
        /** Call fails before touching state. */
        ERROR,
        /** Call reports ok but the write never lands. */
        LOST_WRITE,
        /** Call applies its effect, leaves an orphaned audit entry, then fails. */
        ORPHAN_THEN_ERROR
    }
}
