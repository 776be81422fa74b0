package com.reflow.core.checkpoint;

import com.reflow.core.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot store for one task's world state. Not thread-safe; a task is single-threaded.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final Map<Long, WorldState> snapshots = new HashMap<>();
    private long nextId;

    public CheckpointToken snapshot(WorldState world, String label) {
        CheckpointToken token = new CheckpointToken(nextId++, label);
        snapshots.put(token.id(), world.deepCopy());
        return token;
    }

    /**
     * Returns an independent deep copy of the snapshot.
     *
     * @throws UnknownCheckpointException if the token was never issued or was released
     */
    public WorldState restore(CheckpointToken token) {
        return stored(token).deepCopy();
    }

    /**
     * Undoes on {@code live} the delta between the {@code before} and {@code after} snapshots,
     * leaving changes made after {@code after} (for example Saga compensations) in place.
     * A record that was touched again after {@code after} is not overwritten. Inventory is
     * reverted by subtracting its delta, so later quantity changes are kept on top of it.
     */
    public void revert(WorldState live, CheckpointToken before, CheckpointToken after) {
        WorldState from = stored(before);
        WorldState to = stored(after);
        int reverted = 0;

        Set<String> recordIds = new HashSet<>(from.records().keySet());
        recordIds.addAll(to.records().keySet());
        for (String recordId : recordIds) {
            Map<String, Object> was = from.records().get(recordId);
            Map<String, Object> became = to.records().get(recordId);
            if (Objects.equals(was, became)) {
                continue;
            }
            if (!Objects.equals(live.records().get(recordId), became)) {
                log.debug("Record {} changed after checkpoint {}; leaving it", recordId, after.label());
                continue;
            }
            if (was == null) {
                live.removeRecord(recordId);
            } else {
                live.putRecord(recordId, was);
            }
            reverted++;
        }

        Set<String> itemIds = new HashSet<>(from.inventory().keySet());
        itemIds.addAll(to.inventory().keySet());
        for (String itemId : itemIds) {
            int delta = to.quantity(itemId) - from.quantity(itemId);
            if (delta != 0) {
                live.setQuantity(itemId, live.quantity(itemId) - delta);
                reverted++;
            }
        }

        List<Map<String, Object>> fromAudit = from.auditLog();
        List<Map<String, Object>> toAudit = to.auditLog();
        for (int i = toAudit.size() - 1; i >= fromAudit.size(); i--) {
            if (i < live.auditSize() && Objects.equals(live.auditLog().get(i), toAudit.get(i))) {
                live.removeAuditEntry(i);
                reverted++;
            }
        }
        log.debug("Reverted {} change(s) between {} and {}", reverted, before.label(), after.label());
    }

    public void release(CheckpointToken token) {
        snapshots.remove(token.id());
    }

    public void clear() {
        snapshots.clear();
    }

    public int size() {
        return snapshots.size();
    }

    private WorldState stored(CheckpointToken token) {
        WorldState snapshot = token == null ? null : snapshots.get(token.id());
        if (snapshot == null) {
            throw new UnknownCheckpointException(token);
        }
        return snapshot;
    }
}
