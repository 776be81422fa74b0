package com.reflow.core.oracle;

import com.reflow.core.world.WorldState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    @Test
    @DisplayName("a clean world is consistent")
    void cleanWorld() {
        WorldState world = new WorldState();
        world.putRecord("order-1", Map.of("status", "approved"));
        world.setQuantity("widget", 3);
        world.appendAudit(Map.of("action", "update_record", "record_id", "order-1"));

        ConsistencyReport report = checker.check(world, world.deepCopy(), false);

        assertTrue(report.consistent());
        assertTrue(report.violations().isEmpty());
    }

    @Test
    @DisplayName("negative inventory and orphaned audit entries are violations")
    void violations() {
        WorldState world = new WorldState();
        world.setQuantity("widget", -1);
        world.appendAudit(Map.of("action", "update_record", "record_id", "ghost"));
        world.appendAudit(Map.of("action", "consistency_breach", "critical", true));

        ConsistencyReport report = checker.check(world, new WorldState(), false);

        assertFalse(report.consistent());
        assertEquals(List.of("negative_inventory:widget", "orphan_audit:ghost"), report.violations());
    }

    @Test
    @DisplayName("after compensation, inventory must be back at its initial quantities")
    void inventoryRestoredAfterCompensation() {
        WorldState initial = new WorldState();
        initial.setQuantity("widget", 5);
        WorldState world = initial.deepCopy();
        world.setQuantity("widget", 3);

        assertTrue(checker.check(world, initial, false).consistent());
        assertEquals(List.of("inventory_not_restored:widget"), checker.check(world, initial, true).violations());
    }
}
