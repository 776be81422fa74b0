package com.reflow.core.tools;

import com.reflow.core.model.FaultKind;
import com.reflow.core.model.FaultMode;
import com.reflow.core.model.FaultSpec;
import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.StepError;
import com.reflow.core.model.StepResult;
import com.reflow.core.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolExecutorTest {

    private ToolRegistry registry;
    private ToolExecutor executor;
    private WorldState world;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        executor = new ToolExecutor();
        world = new WorldState();
        world.putRecord("order-1", Map.of("status", "pending"));
        world.setQuantity("widget", 3);
    }

    private static InjectedFault fault(FaultKind kind) {
        return InjectedFault.of(FaultSpec.forward(0, kind, FaultMode.ONCE));
    }

    private static Map<String, Object> approve() {
        return Map.of("record_id", "order-1", "patch", Map.of("status", "approved"));
    }

    @Nested
    @DisplayName("without a fault")
    class Healthy {

        @Test
        @DisplayName("update_record applies the patch and returns the previous image")
        void updateApplies() {
            StepResult result = executor.execute(registry.require("update_record"), world, approve(), null, 12);

            assertTrue(result.isOk());
            assertEquals(12, result.latencyMs());
            assertEquals("approved", world.record("order-1").orElseThrow().get("status"));
            assertEquals(Map.of("status", "pending"), result.output().get("previous"));
            assertNull(result.injectedFault());
        }

        @Test
        @DisplayName("a refused call becomes a ToolError")
        void refusalBecomesToolError() {
            StepResult result = executor.execute(registry.require("lock_inventory"), world,
                    Map.of("item_id", "widget", "qty", 10), null, 5);

            assertFalse(result.isOk());
            assertEquals(StepError.TOOL_ERROR, result.errorKind());
            assertEquals(3, world.quantity("widget"));
        }

        @Test
        @DisplayName("an unknown tool name is rejected by the registry")
        void unknownTool() {
            assertThrows(IllegalArgumentException.class, () -> registry.require("teleport"));
        }
    }

    @Nested
    @DisplayName("with an injected fault")
    class Injected {

        @Test
        @DisplayName("an error fault leaves the world untouched")
        void errorFaultHasNoEffect() {
            String before = world.hash();

            StepResult result = executor.execute(registry.require("update_record"), world, approve(),
                    fault(FaultKind.HTTP_500), 40);

            assertEquals("HTTP_500", result.errorKind());
            assertEquals(FaultKind.HTTP_500, result.injectedFault().kind());
            assertEquals(before, world.hash());
            assertFalse(result.effectApplied());
        }

        @Test
        @DisplayName("a stale write is lost and caught by the post-condition")
        void staleWriteViolatesPostCondition() {
            StepResult result = executor.execute(registry.require("update_record"), world, approve(),
                    fault(FaultKind.STALE_WRITE), 20);

            assertEquals(StepError.POST_CONDITION_VIOLATED, result.errorKind());
            assertFalse(result.effectApplied());
            assertEquals("pending", world.record("order-1").orElseThrow().get("status"));
        }

        @Test
        @DisplayName("a stale write on a tool without post-condition reports ok")
        void staleWriteWithoutPostConditionIsSilent() {
            StepResult result = executor.execute(registry.require("lock_inventory"), world,
                    Map.of("item_id", "widget", "qty", 1), fault(FaultKind.STALE_WRITE), 20);

            assertTrue(result.isOk());
            assertNotNull(result.injectedFault());
            assertEquals(3, world.quantity("widget"));
        }

        @Test
        @DisplayName("a cascade fault applies the effect, leaves an orphan and fails")
        void cascadeLeavesOrphan() {
            StepResult result = executor.execute(registry.require("update_record"), world, approve(),
                    fault(FaultKind.STATE_CORRUPTION), 30);

            assertEquals("StateCorruption", result.errorKind());
            assertTrue(result.effectApplied());
            assertEquals("approved", world.record("order-1").orElseThrow().get("status"));
            Map<String, Object> last = world.auditLog().get(world.auditSize() - 1);
            assertEquals("orphan_write", last.get("action"));
            assertEquals("orphan-f0-StateCorruption", last.get("record_id"));
        }
    }

    @Test
    @DisplayName("irreversible and compensable metadata of the built-in tools")
    void builtinMetadata() {
        assertTrue(registry.require("notify_user").irreversible());
        assertTrue(registry.require("send_message").irreversible());
        assertTrue(registry.require("commit").irreversible());
        assertEquals("unlock_inventory", registry.require("lock_inventory").compensatingTool());
        assertEquals("refund_payment", registry.require("process_payment").compensatingTool());
        assertFalse(registry.require("get_record").compensable());
    }

    @Test
    @DisplayName("an irreversible tool cannot name a compensation")
    void irreversibleCannotBeCompensated() {
        ToolSpec spec = ToolSpec.of("launch", (w, a) -> Map.of()).asIrreversible();
        assertThrows(IllegalArgumentException.class,
                () -> spec.compensatedBy("recall", (args, output) -> Map.of()));
    }
}
