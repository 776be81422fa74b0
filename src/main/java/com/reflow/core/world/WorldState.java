package com.reflow.core.world;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable world of one task: records, inventory and the audit log.
 * <p>
 * Only tool calls (and checkpoint restore/revert) mutate it. Every accessor returns an
 * unmodifiable view; {@link #deepCopy()} yields a fully independent instance.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorldState {

    private final TreeMap<String, Map<String, Object>> records = new TreeMap<>();
    private final TreeMap<String, Integer> inventory = new TreeMap<>();
    private final List<Map<String, Object>> auditLog = new ArrayList<>();

    public WorldState() {
    }

    @JsonCreator
    public WorldState(@JsonProperty("records") Map<String, Map<String, Object>> records,
                      @JsonProperty("inventory") Map<String, Integer> inventory,
                      @JsonProperty("audit_log") List<Map<String, Object>> auditLog) {
        if (records != null) {
            records.forEach(this::putRecord);
        }
        if (inventory != null) {
            inventory.forEach(this::setQuantity);
        }
        if (auditLog != null) {
            auditLog.forEach(this::appendAudit);
        }
    }

    @JsonProperty("records")
    public Map<String, Map<String, Object>> records() {
        return Collections.unmodifiableMap(records);
    }

    @JsonProperty("inventory")
    public Map<String, Integer> inventory() {
        return Collections.unmodifiableMap(inventory);
    }

    @JsonProperty("audit_log")
    public List<Map<String, Object>> auditLog() {
        return Collections.unmodifiableList(auditLog);
    }

    public Optional<Map<String, Object>> record(String recordId) {
        return Optional.ofNullable(records.get(recordId)).map(Collections::unmodifiableMap);
    }

    public boolean hasRecord(String recordId) {
        return records.containsKey(recordId);
    }

    public void putRecord(String recordId, Map<String, Object> fields) {
        records.put(recordId, copyMap(fields));
    }

    public void removeRecord(String recordId) {
        records.remove(recordId);
    }

    /** Quantity of an item; absent items count as zero. */
    public int quantity(String itemId) {
        return inventory.getOrDefault(itemId, 0);
    }

    public void setQuantity(String itemId, int quantity) {
        inventory.put(itemId, quantity);
    }

    public void removeItem(String itemId) {
        inventory.remove(itemId);
    }

    public void appendAudit(Map<String, Object> entry) {
        auditLog.add(copyMap(entry));
    }

    public int auditSize() {
        return auditLog.size();
    }

    /** Drops audit entries beyond {@code size}. */
    public void truncateAudit(int size) {
        while (auditLog.size() > size) {
            auditLog.remove(auditLog.size() - 1);
        }
    }

    public void removeAuditEntry(int index) {
        auditLog.remove(index);
    }

    public WorldState deepCopy() {
        WorldState copy = new WorldState();
        copy.replaceWith(this);
        return copy;
    }

    /** Replaces the whole content of this world with a deep copy of {@code other}. */
    public void replaceWith(WorldState other) {
        if (other == this) {
            return;
        }
        records.clear();
        inventory.clear();
        auditLog.clear();
        other.records.forEach(this::putRecord);
        inventory.putAll(other.inventory);
        other.auditLog.forEach(this::appendAudit);
    }

    /** Canonical SHA-256 content hash. */
    public String hash() {
        return StateHasher.hash(this);
    }

    @Override
    public String toString() {
        return "WorldState{records=" + records.keySet() + ", inventory=" + inventory
                + ", audit=" + auditLog.size() + "}";
    }

    static Map<String, Object> copyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
