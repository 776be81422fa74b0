package com.reflow.core.fault;

import com.reflow.core.model.FaultKind;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.FaultMode;
import com.reflow.core.model.FaultPhase;
import com.reflow.core.model.FaultSpec;
import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.StepDefinition;
import com.reflow.core.model.Task;
import com.reflow.core.world.WorldState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FaultInjectorTest {

    private static Task task(String id, FaultSpec... faults) {
        return new Task(id, new WorldState(),
                List.of(new StepDefinition("a", "get_record", Map.of("record_id", "r")),
                        new StepDefinition("b", "lock_inventory", Map.of("item_id", "i", "qty", 1))),
                List.of(faults), null);
    }

    @Nested
    @DisplayName("modes")
    class Modes {

        private final FaultInjector injector = new FaultInjector(42L);

        @Test
        @DisplayName("once fires only on the first attempt")
        void onceFiresFirstAttemptOnly() {
            Task task = task("t", FaultSpec.forward(1, FaultKind.TIMEOUT, FaultMode.ONCE));

            assertTrue(injector.inject(task, 1, 0, 0).isPresent());
            assertTrue(injector.inject(task, 1, 1, 0).isEmpty());
            assertTrue(injector.inject(task, 0, 0, 0).isEmpty());
        }

        @Test
        @DisplayName("persistent fires on every attempt")
        void persistentFiresAlways() {
            Task task = task("t", FaultSpec.forward(1, FaultKind.HTTP_500, FaultMode.PERSISTENT));

            for (int attempt = 0; attempt < 5; attempt++) {
                assertTrue(injector.inject(task, 1, attempt, attempt).isPresent());
            }
        }

        @Test
        @DisplayName("stateful conflict stops once a rollback was observed")
        void statefulConflictClearsAfterRollback() {
            Task task = task("t", FaultSpec.forward(1, FaultKind.CONFLICT, FaultMode.STATEFUL_CONFLICT));

            assertTrue(injector.inject(task, 1, 0, 0).isPresent());
            assertTrue(injector.inject(task, 1, 1, 0).isPresent());
            assertTrue(injector.inject(task, 1, 2, 1).isEmpty());
        }

        @Test
        @DisplayName("probability zero never fires")
        void zeroProbabilityNeverFires() {
            FaultSpec never = new FaultSpec(1, FaultKind.TIMEOUT, 0.0, null, null, FaultMode.PER_ATTEMPT,
                    null, null, null);
            Task task = task("t", never);

            for (int attempt = 0; attempt < 10; attempt++) {
                assertTrue(injector.inject(task, 1, attempt, 0).isEmpty());
            }
        }

        @Test
        @DisplayName("compensation-phase entries only hit the named compensating call")
        void compensationPhase() {
            Task task = task("t", FaultSpec.compensation(1, "unlock_inventory", FaultKind.TIMEOUT));

            assertTrue(injector.inject(task, 1, 0, 0).isEmpty());
            assertTrue(injector.injectCompensation(task, "unlock_inventory", 1).isPresent());
            assertTrue(injector.injectCompensation(task, "refund_payment", 1).isEmpty());
            assertTrue(injector.injectCompensation(task, "unlock_inventory", 0).isEmpty());
        }
    }

    @Test
    @DisplayName("the same seed yields the same decisions; the decision ignores the caller's history")
    void deterministicAcrossInstances() {
        FaultSpec coinFlip = new FaultSpec(1, FaultKind.RATE_LIMITED, 0.5, "flip", null, FaultMode.PER_ATTEMPT,
                null, FaultPhase.FORWARD, null);
        List<Boolean> first = new ArrayList<>();
        List<Boolean> second = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            Task task = task("task-" + i, coinFlip);
            first.add(new FaultInjector(7L).inject(task, 1, i % 4, 0).isPresent());
        }
        for (int i = 0; i < 40; i++) {
            Task task = task("task-" + i, coinFlip);
            second.add(new FaultInjector(7L).inject(task, 1, i % 4, 0).isPresent());
        }

        assertEquals(first, second);
        assertTrue(first.contains(true));
        assertTrue(first.contains(false));
    }

    @Test
    @DisplayName("injected descriptor carries the layer override")
    void layerOverride() {
        FaultSpec spec = new FaultSpec(0, FaultKind.TIMEOUT, 1.0, "x", FaultLayer.CASCADE,
                null, "s1", null, null);

        Optional<InjectedFault> fault = new FaultInjector(1L).inject(task("t", spec), 0, 0, 0);

        assertEquals(FaultLayer.CASCADE, fault.orElseThrow().layer());
        assertEquals("s1", fault.orElseThrow().scenario());
    }

    @Test
    @DisplayName("simulated latency stays within the kind's range")
    void latencyWithinRange() {
        FaultInjector injector = new FaultInjector(3L);
        InjectedFault timeout = InjectedFault.of(FaultSpec.forward(0, FaultKind.TIMEOUT, FaultMode.ONCE));
        for (int attempt = 0; attempt < 20; attempt++) {
            long latency = injector.faultLatencyMs("t", timeout, attempt);
            assertTrue(latency >= 50 && latency <= 150, "latency " + latency);
            long call = injector.callLatencyMs("t", 0, attempt, "get_record");
            assertTrue(call >= 5 && call <= 20, "call latency " + call);
        }
    }
}
