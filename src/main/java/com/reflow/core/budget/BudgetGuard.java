package com.reflow.core.budget;

import java.util.Optional;

/**
 * Tracks one task's consumption against its {@link BudgetLimits}.
 * <p>
 * Counters only grow. {@link #admit} refuses (and consumes nothing) when the cost would push
 * a counter past its ceiling or the time ceiling has been reached.
 */
public class BudgetGuard {

    public static final String TOKENS = "tokens";
    public static final String TOOL_CALLS = "tool_calls";
    public static final String TIME = "time";

    private final BudgetLimits limits;
    private final TaskClock clock;
    private final long startMs;
    private int usedTokens;
    private int usedToolCalls;

    public BudgetGuard(BudgetLimits limits, TaskClock clock) {
        this.limits = limits;
        this.clock = clock;
        this.startMs = clock.millis();
    }

    public boolean admit(int tokens, int toolCalls) {
        if (refusal(tokens, toolCalls).isPresent()) {
            return false;
        }
        usedTokens += tokens;
        usedToolCalls += toolCalls;
        return true;
    }

    /** Why an action of the given cost would be refused, or empty if it fits. */
    public Optional<String> refusal(int tokens, int toolCalls) {
        if (elapsedMs() >= limits.maxTimeMs()) {
            return Optional.of(TIME);
        }
        if (usedToolCalls + toolCalls > limits.maxToolCalls()) {
            return Optional.of(TOOL_CALLS);
        }
        if (usedTokens + tokens > limits.maxTokens()) {
            return Optional.of(TOKENS);
        }
        return Optional.empty();
    }

    /** True once no further tool call can be admitted. */
    public boolean exhausted() {
        return exhaustionReason().isPresent();
    }

    public Optional<String> exhaustionReason() {
        if (elapsedMs() >= limits.maxTimeMs()) {
            return Optional.of(TIME);
        }
        if (usedToolCalls >= limits.maxToolCalls()) {
            return Optional.of(TOOL_CALLS);
        }
        if (usedTokens >= limits.maxTokens()) {
            return Optional.of(TOKENS);
        }
        return Optional.empty();
    }

    public long elapsedMs() {
        return clock.millis() - startMs;
    }

    public int usedTokens() {
        return usedTokens;
    }

    public int usedToolCalls() {
        return usedToolCalls;
    }

    public BudgetSnapshot snapshot() {
        long elapsed = elapsedMs();
        return new BudgetSnapshot(usedTokens, usedToolCalls, elapsed,
                Math.max(0, limits.maxTokens() - usedTokens),
                Math.max(0, limits.maxToolCalls() - usedToolCalls),
                Math.max(0L, limits.maxTimeMs() - elapsed));
    }
}
