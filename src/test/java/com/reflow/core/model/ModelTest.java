package com.reflow.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("strategies parse from code or name")
    void strategyParsing() {
        assertEquals(StrategyType.RULE_BASED, StrategyType.parse("B2"));
        assertEquals(StrategyType.MEMORY_AUGMENTED, StrategyType.parse("memory-augmented"));
        assertEquals(StrategyType.NO_RECOVERY, StrategyType.parse(" b0 "));
        assertThrows(IllegalArgumentException.class, () -> StrategyType.parse("B7"));
        assertThrows(IllegalArgumentException.class, () -> StrategyType.parse(""));
    }

    @Test
    @DisplayName("fault kinds parse from wire or enum name and carry their layer")
    void faultKinds() {
        assertEquals(FaultKind.RATE_LIMITED, FaultKind.fromWire("RateLimited"));
        assertEquals(FaultKind.STALE_WRITE, FaultKind.fromWire("stale_write"));
        assertEquals(FaultLayer.CASCADE, FaultKind.PARTIAL_FAILURE.layer());
        assertNull(FaultKind.lookup("PostConditionViolated"));
        assertThrows(IllegalArgumentException.class, () -> FaultKind.fromWire("Meteor"));
    }

    @Test
    @DisplayName("fault schedule entries fill defaults and validate probability")
    void faultSpecDefaults() {
        FaultSpec spec = new FaultSpec(2, FaultKind.CONFLICT, null, null, null, null, null, null, null);

        assertEquals(1.0, spec.probability());
        assertEquals("f2-Conflict", spec.faultId());
        assertEquals(FaultLayer.PERSISTENT, spec.effectiveLayer());
        assertThrows(IllegalArgumentException.class,
                () -> new FaultSpec(0, FaultKind.TIMEOUT, 1.5, null, null, null, null, null, null));
    }

    @Test
    @DisplayName("handled outcomes")
    void handledOutcomes() {
        assertTrue(new TaskResult("t", TaskOutcome.ESCALATED, "escalated:Conflict", 3, 1, true, true, 0, 0).handled());
        assertFalse(new TaskResult("t", TaskOutcome.UNHANDLED, "compensation_failed:x", 3, 1, true, false, 0, 0).handled());
    }
}
