package com.reflow.core.metrics;

import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.TaskOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for recovery runs.
 */
@Service
public class RecoveryMetrics {

    private final MeterRegistry registry;

    public RecoveryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskOutcome(String strategy, TaskOutcome outcome) {
        Counter.builder("reflow.tasks.total")
                .tag("strategy", strategy)
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordDecision(String strategy, RecoveryAction action, DecisionSource source) {
        Counter.builder("reflow.decisions.total")
                .tag("strategy", strategy)
                .tag("action", action.name())
                .tag("source", source.name())
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("reflow.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCompensation(String tool, boolean succeeded) {
        Counter.builder("reflow.compensations.total")
                .description("Compensating calls issued during Saga unwinds")
                .tag("tool", tool)
                .tag("succeeded", String.valueOf(succeeded))
                .register(registry)
                .increment();
    }

    public void recordMemoryLookup(boolean hit) {
        Counter.builder("reflow.memory.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void incrementDiagnosisCalls() {
        Counter.builder("reflow.diagnosis.calls")
                .register(registry)
                .increment();
    }

    public void recordAttemptsPerTask(int attempts) {
        DistributionSummary.builder("reflow.task.attempts")
                .description("Tool attempts per task, forward and compensation")
                .register(registry)
                .record(attempts);
    }

    public void recordTaskDuration(long ms) {
        Timer.builder("reflow.task.duration")
                .description("Simulated or wall time per task")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
