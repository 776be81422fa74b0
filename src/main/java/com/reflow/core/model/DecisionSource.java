package com.reflow.core.model;

/**
 * Where a recovery decision came from.
 */
public enum DecisionSource {
    BASELINE,
    RULE,
    DIAGNOSIS,
    MEMORY,
    GUARD,
    BUDGET
}
