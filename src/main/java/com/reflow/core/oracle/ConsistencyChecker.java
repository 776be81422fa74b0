package com.reflow.core.oracle;

import com.reflow.core.world.WorldState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the world-state invariants at a task boundary:
 * no negative inventory, no audit entry pointing at a missing record, and, after a
 * compensating unwind, inventory back at its initial quantities.
 */
@Component
public class ConsistencyChecker {

    public ConsistencyReport check(WorldState world, WorldState initial, boolean compensated) {
        List<String> violations = new ArrayList<>();

        world.inventory().forEach((item, qty) -> {
            if (qty < 0) {
                violations.add("negative_inventory:" + item);
            }
        });

        for (Map<String, Object> entry : world.auditLog()) {
            Object recordId = entry.get("record_id");
            if (recordId != null && !world.hasRecord(recordId.toString())) {
                violations.add("orphan_audit:" + recordId);
            }
        }

        if (compensated && initial != null) {
            Set<String> items = new HashSet<>(initial.inventory().keySet());
            items.addAll(world.inventory().keySet());
            items.stream().sorted().forEach(item -> {
                if (world.quantity(item) != initial.quantity(item)) {
                    violations.add("inventory_not_restored:" + item);
                }
            });
        }
        return ConsistencyReport.of(violations);
    }
}
