package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a scheduled fault behaves across repeated attempts of the same step.
 */
public enum FaultMode {
    /** Only the first attempt rolls the dice. */
    ONCE,
    /** Every attempt rolls independently. */
    PER_ATTEMPT,
    /** Rolled once; the outcome sticks for every attempt. */
    PERSISTENT,
    /** Fires until a rollback has been observed at the step. */
    STATEFUL_CONFLICT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FaultMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ONCE;
        }
        return FaultMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
