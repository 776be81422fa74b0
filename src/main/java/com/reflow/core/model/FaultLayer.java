package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ground-truth classification of a fault, used by rule-based recovery and by diagnosis.
 */
public enum FaultLayer {
    TRANSIENT,
    PERSISTENT,
    SEMANTIC,
    CASCADE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a layer name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known layer
     */
    @JsonCreator
    public static FaultLayer fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Fault layer must not be null");
        }
        return FaultLayer.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
