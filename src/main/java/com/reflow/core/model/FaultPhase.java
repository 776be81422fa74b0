package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a scheduled fault targets a forward step or a compensating call.
 */
public enum FaultPhase {
    FORWARD,
    COMPENSATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FaultPhase fromWire(String value) {
        if (value == null || value.isBlank()) {
            return FORWARD;
        }
        return FaultPhase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
