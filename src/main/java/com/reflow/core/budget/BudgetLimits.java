package com.reflow.core.budget;

import com.reflow.core.config.ReflowProperties;

/**
 * Per-task ceilings.
 */
public record BudgetLimits(int maxTokens, int maxToolCalls, long maxTimeMs) {

    public static final BudgetLimits DEFAULT = new BudgetLimits(10_000, 50, 60_000L);

    public BudgetLimits {
        if (maxTokens <= 0 || maxToolCalls <= 0 || maxTimeMs <= 0) {
            throw new IllegalArgumentException("Budget ceilings must be positive");
        }
    }

    public static BudgetLimits from(ReflowProperties.Budget budget) {
        return new BudgetLimits(budget.getMaxTokens(), budget.getMaxToolCalls(), budget.getMaxTimeMs());
    }
}
