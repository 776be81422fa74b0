package com.reflow.core.checkpoint;

import com.reflow.core.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerTest {

    private CheckpointManager manager;
    private WorldState world;

    @BeforeEach
    void setUp() {
        manager = new CheckpointManager();
        world = new WorldState();
        world.putRecord("order-1", Map.of("status", "pending"));
        world.setQuantity("widget", 5);
    }

    @Test
    @DisplayName("restore returns the snapshot content, independent of later changes")
    void restoreReturnsSnapshot() {
        String before = world.hash();
        CheckpointToken token = manager.snapshot(world, "start");

        world.putRecord("order-1", Map.of("status", "approved"));
        WorldState restored = manager.restore(token);
        restored.setQuantity("widget", 0);

        assertEquals(before, manager.restore(token).hash());
    }

    @Test
    @DisplayName("restoring an unknown or released token throws")
    void unknownTokenThrows() {
        CheckpointToken token = manager.snapshot(world, "start");
        manager.release(token);

        assertThrows(UnknownCheckpointException.class, () -> manager.restore(token));
        assertThrows(UnknownCheckpointException.class, () -> manager.restore(new CheckpointToken(99, "never")));
    }

    @Test
    @DisplayName("revert undoes the delta between two snapshots and keeps later changes")
    void revertUndoesDeltaOnly() {
        CheckpointToken before = manager.snapshot(world, "before");
        world.putRecord("order-1", Map.of("status", "approved"));
        world.putRecord("orphan", Map.of("x", 1));
        world.setQuantity("widget", 3);
        world.appendAudit(Map.of("action", "update_record", "record_id", "order-1"));
        CheckpointToken after = manager.snapshot(world, "after");

        // a later, independent change
        world.setQuantity("widget", 4);
        world.appendAudit(Map.of("action", "unlock_inventory"));

        manager.revert(world, before, after);

        assertEquals("pending", world.record("order-1").orElseThrow().get("status"));
        assertFalse(world.hasRecord("orphan"));
        assertEquals(6, world.quantity("widget"));
        assertEquals(1, world.auditSize());
        assertEquals("unlock_inventory", world.auditLog().get(0).get("action"));
    }

    @Test
    @DisplayName("revert leaves a record alone when it changed again after the second snapshot")
    void revertSkipsRetouchedRecord() {
        CheckpointToken before = manager.snapshot(world, "before");
        world.putRecord("order-1", Map.of("status", "approved"));
        CheckpointToken after = manager.snapshot(world, "after");
        world.putRecord("order-1", Map.of("status", "cancelled"));

        manager.revert(world, before, after);

        assertEquals("cancelled", world.record("order-1").orElseThrow().get("status"));
    }

    @Test
    @DisplayName("clear drops every snapshot")
    void clearDropsAll() {
        manager.snapshot(world, "a");
        manager.snapshot(world, "b");
        assertEquals(2, manager.size());
        manager.clear();
        assertEquals(0, manager.size());
    }
}
