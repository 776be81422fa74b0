package com.reflow.core.model;

import java.util.Locale;

/**
 * Recovery strategies selectable for a run, with their short benchmark codes.
 */
public enum StrategyType {
    NO_RECOVERY("B0"),
    NAIVE_RETRY("B1"),
    RULE_BASED("B2"),
    DIAGNOSIS("B3"),
    MEMORY_AUGMENTED("B4");

    private final String code;

    StrategyType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Accepts either the short code ({@code B2}) or the enum name ({@code rule_based}).
     */
    public static StrategyType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Strategy must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (StrategyType type : values()) {
            if (type.code.equals(normalized) || type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value
                + ". Valid: B0, B1, B2, B3, B4 or " + java.util.Arrays.toString(values()));
    }
}
