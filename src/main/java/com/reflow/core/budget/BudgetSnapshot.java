package com.reflow.core.budget;

/**
 * Point-in-time view of a task's budget.
 */
public record BudgetSnapshot(
        int usedTokens,
        int usedToolCalls,
        long elapsedMs,
        int remainingTokens,
        int remainingToolCalls,
        long remainingMs
) {}
