package com.reflow.core.metrics;

import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.TaskOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryMetricsTest {

    private SimpleMeterRegistry registry;
    private RecoveryMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RecoveryMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskOutcome counts by strategy and outcome")
    void recordTaskOutcome() {
        metrics.recordTaskOutcome("B2", TaskOutcome.SUCCESS);
        metrics.recordTaskOutcome("B2", TaskOutcome.SUCCESS);
        metrics.recordTaskOutcome("B2", TaskOutcome.ESCALATED);

        var success = registry.find("reflow.tasks.total").tag("strategy", "B2").tag("outcome", "SUCCESS").counter();
        var escalated = registry.find("reflow.tasks.total").tag("outcome", "ESCALATED").counter();

        assertNotNull(success);
        assertNotNull(escalated);
        assertEquals(2.0, success.count());
        assertEquals(1.0, escalated.count());
    }

    @Test
    @DisplayName("recordDecision tags action and source")
    void recordDecision() {
        metrics.recordDecision("B4", RecoveryAction.ROLLBACK_THEN_RETRY, DecisionSource.MEMORY);

        var counter = registry.find("reflow.decisions.total")
                .tag("action", "ROLLBACK_THEN_RETRY").tag("source", "MEMORY").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordMemoryLookup splits hits and misses")
    void recordMemoryLookup() {
        metrics.recordMemoryLookup(true);
        metrics.recordMemoryLookup(false);
        metrics.recordMemoryLookup(false);

        assertEquals(1.0, registry.find("reflow.memory.lookups").tag("result", "hit").counter().count());
        assertEquals(2.0, registry.find("reflow.memory.lookups").tag("result", "miss").counter().count());
    }

    @Test
    @DisplayName("recordCompensation tags tool and outcome")
    void recordCompensation() {
        metrics.recordCompensation("unlock_inventory", false);

        var counter = registry.find("reflow.compensations.total")
                .tag("tool", "unlock_inventory").tag("succeeded", "false").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("per-task attempts and duration are recorded")
    void attemptsAndDuration() {
        metrics.recordAttemptsPerTask(4);
        metrics.recordAttemptsPerTask(6);
        metrics.recordTaskDuration(120);

        var summary = registry.find("reflow.task.attempts").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(10.0, summary.totalAmount());
        assertEquals(1, registry.find("reflow.task.duration").timer().count());
    }

    @Test
    @DisplayName("escalations and diagnosis calls are counted")
    void escalationsAndDiagnosisCalls() {
        metrics.incrementEscalations("HTTP_500");
        metrics.incrementDiagnosisCalls();
        metrics.incrementDiagnosisCalls();

        assertEquals(1.0, registry.find("reflow.escalations.total").tag("reason", "HTTP_500").counter().count());
        assertEquals(2.0, registry.find("reflow.diagnosis.calls").counter().count());
    }
}
