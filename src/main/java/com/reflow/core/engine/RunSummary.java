package com.reflow.core.engine;

import com.reflow.core.model.StrategyType;
import com.reflow.core.model.TaskOutcome;
import com.reflow.core.model.TaskResult;
import com.reflow.core.trace.TraceEvent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one run over a task set: per-task results and the full trace, both in task order.
 */
public record RunSummary(StrategyType strategy, long seed, List<TaskResult> results, List<TraceEvent> events) {

    public RunSummary {
        results = List.copyOf(results);
        events = List.copyOf(events);
    }

    public Map<TaskOutcome, Integer> outcomeCounts() {
        Map<TaskOutcome, Integer> counts = new EnumMap<>(TaskOutcome.class);
        for (TaskOutcome outcome : TaskOutcome.values()) {
            counts.put(outcome, 0);
        }
        results.forEach(result -> counts.merge(result.outcome(), 1, Integer::sum));
        return counts;
    }

    public int count(TaskOutcome outcome) {
        return outcomeCounts().get(outcome);
    }

    /** Share of tasks that ended successful or cleanly escalated. */
    public double handledRate() {
        if (results.isEmpty()) {
            return 0.0;
        }
        return (double) results.stream().filter(TaskResult::handled).count() / results.size();
    }

    public int diagnosisCalls() {
        return results.stream().mapToInt(TaskResult::diagnosisCalls).sum();
    }

    public int memoryHits() {
        return results.stream().mapToInt(TaskResult::memoryHits).sum();
    }

    public int inconsistentTasks() {
        return (int) results.stream().filter(result -> !result.consistent()).count();
    }
}
