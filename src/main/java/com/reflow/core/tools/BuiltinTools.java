package com.reflow.core.tools;

import com.reflow.core.world.WorldState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The stateless mock API the workflows call. Audit entries carry no wall-clock timestamps so
 * that state hashes stay reproducible.
 */
final class BuiltinTools {

    static final String PAYMENT_PREFIX = "payment-";

    private BuiltinTools() {}

    static List<ToolSpec> specs() {
        return List.of(
                ToolSpec.of("get_record", BuiltinTools::getRecord),
                ToolSpec.of("auth_check", BuiltinTools::authCheck),
                ToolSpec.of("policy_check", BuiltinTools::policyCheck),
                ToolSpec.of("update_record", BuiltinTools::updateRecord)
                        .compensatedBy("restore_record", (args, output) -> Map.of(
                                "record_id", args.get("record_id"),
                                "previous", output.get("previous")))
                        .withPostCondition(BuiltinTools::patchApplied),
                ToolSpec.of("restore_record", BuiltinTools::restoreRecord),
                ToolSpec.of("lock_inventory", BuiltinTools::lockInventory)
                        .compensatedBy("unlock_inventory", (args, output) -> Map.of(
                                "item_id", args.get("item_id"),
                                "qty", args.get("qty"))),
                ToolSpec.of("unlock_inventory", BuiltinTools::unlockInventory),
                ToolSpec.of("process_payment", BuiltinTools::processPayment)
                        .compensatedBy("refund_payment", (args, output) -> Map.of(
                                "order_id", args.get("order_id"),
                                "amount", args.get("amount")))
                        .withPostCondition(BuiltinTools::paymentCaptured),
                ToolSpec.of("refund_payment", BuiltinTools::refundPayment),
                ToolSpec.of("write_audit", BuiltinTools::writeAudit),
                ToolSpec.of("notify_user", BuiltinTools::notifyUser).asIrreversible(),
                ToolSpec.of("send_message", BuiltinTools::sendMessage).asIrreversible(),
                ToolSpec.of("commit", BuiltinTools::commit).asIrreversible(),
                ToolSpec.of("create_ticket", BuiltinTools::createTicket)
        );
    }

    static Map<String, Object> getRecord(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        Map<String, Object> record = world.record(recordId)
                .orElseThrow(() -> new ToolException("Record " + recordId + " not found"));
        return Map.of("record", new LinkedHashMap<>(record));
    }

    static Map<String, Object> authCheck(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        Map<String, Object> record = world.record(recordId)
                .orElseThrow(() -> new ToolException("Record " + recordId + " not found"));
        if ("denied".equals(record.get("auth"))) {
            throw new ToolException("Authorization denied for " + recordId);
        }
        return Map.of("record_id", recordId, "authorized", true);
    }

    static Map<String, Object> policyCheck(WorldState world, Map<String, Object> args) throws ToolException {
        String action = ToolArgs.string(args, "action", "approve");
        Map<String, Object> context = ToolArgs.map(args, "context");
        Object required = context.getOrDefault("required_inventory", Map.of());
        if (required instanceof Map<?, ?> requiredInventory) {
            for (Map.Entry<?, ?> entry : requiredInventory.entrySet()) {
                int needed = entry.getValue() instanceof Number n ? n.intValue() : 0;
                if (world.quantity(entry.getKey().toString()) < needed) {
                    throw new ToolException("Insufficient inventory: " + entry.getKey());
                }
            }
        }
        return Map.of("allowed", true, "action", action);
    }

    static Map<String, Object> updateRecord(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        Map<String, Object> patch = ToolArgs.map(args, "patch");
        Map<String, Object> previous = world.record(recordId)
                .map(LinkedHashMap::new)
                .orElseThrow(() -> new ToolException("Record " + recordId + " not found"));
        Map<String, Object> updated = new LinkedHashMap<>(previous);
        updated.putAll(patch);
        world.putRecord(recordId, updated);
        world.appendAudit(Map.of("action", "update_record", "record_id", recordId, "patch", patch));
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("record_id", recordId);
        output.put("updated", true);
        output.put("previous", previous);
        return output;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> restoreRecord(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        Object previous = args.get("previous");
        if (!(previous instanceof Map<?, ?>)) {
            throw new ToolException("No previous image for record " + recordId);
        }
        world.putRecord(recordId, (Map<String, Object>) previous);
        world.appendAudit(Map.of("action", "restore_record", "record_id", recordId));
        return Map.of("record_id", recordId, "restored", true);
    }

    static Map<String, Object> lockInventory(WorldState world, Map<String, Object> args) throws ToolException {
        String itemId = ToolArgs.string(args, "item_id");
        int qty = ToolArgs.integer(args, "qty");
        int available = world.quantity(itemId);
        if (available < qty) {
            throw new ToolException("Insufficient inventory: " + itemId + " (" + available + " < " + qty + ")");
        }
        world.setQuantity(itemId, available - qty);
        world.appendAudit(Map.of("action", "lock_inventory", "item_id", itemId, "qty", qty));
        return Map.of("item_id", itemId, "locked", qty);
    }

    static Map<String, Object> unlockInventory(WorldState world, Map<String, Object> args) throws ToolException {
        String itemId = ToolArgs.string(args, "item_id");
        int qty = ToolArgs.integer(args, "qty");
        world.setQuantity(itemId, world.quantity(itemId) + qty);
        world.appendAudit(Map.of("action", "unlock_inventory", "item_id", itemId, "qty", qty));
        return Map.of("item_id", itemId, "unlocked", qty);
    }

    static Map<String, Object> processPayment(WorldState world, Map<String, Object> args) throws ToolException {
        String orderId = ToolArgs.string(args, "order_id");
        int amount = ToolArgs.integer(args, "amount");
        String paymentId = PAYMENT_PREFIX + orderId;
        world.putRecord(paymentId, Map.of("order_id", orderId, "amount", amount, "status", "captured"));
        world.appendAudit(Map.of("action", "process_payment", "record_id", paymentId, "amount", amount));
        return Map.of("payment_id", paymentId, "captured", amount);
    }

    static Map<String, Object> refundPayment(WorldState world, Map<String, Object> args) throws ToolException {
        String orderId = ToolArgs.string(args, "order_id");
        int amount = ToolArgs.integer(args, "amount");
        String paymentId = PAYMENT_PREFIX + orderId;
        Map<String, Object> payment = world.record(paymentId)
                .map(LinkedHashMap::new)
                .orElseThrow(() -> new ToolException("No payment for order " + orderId));
        payment.put("status", "refunded");
        world.putRecord(paymentId, payment);
        world.appendAudit(Map.of("action", "refund_payment", "record_id", paymentId, "amount", amount));
        return Map.of("payment_id", paymentId, "refunded", amount);
    }

    static Map<String, Object> writeAudit(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        world.appendAudit(Map.of("action", "write_audit", "record_id", recordId));
        return Map.of("record_id", recordId, "written", true);
    }

    static Map<String, Object> notifyUser(WorldState world, Map<String, Object> args) throws ToolException {
        String recordId = ToolArgs.string(args, "record_id");
        world.appendAudit(Map.of("action", "notify_user", "record_id", recordId));
        return Map.of("record_id", recordId, "notified", true);
    }

    static Map<String, Object> sendMessage(WorldState world, Map<String, Object> args) throws ToolException {
        String userId = ToolArgs.string(args, "user_id");
        String text = ToolArgs.string(args, "text", "");
        world.appendAudit(Map.of("action", "send_message", "user_id", userId, "text", text));
        return Map.of("user_id", userId, "sent", true);
    }

    static Map<String, Object> commit(WorldState world, Map<String, Object> args) {
        world.appendAudit(Map.of("action", "commit"));
        return Map.of("committed", true);
    }

    static Map<String, Object> createTicket(WorldState world, Map<String, Object> args) {
        String ticketId = "TKT-" + world.auditSize();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", "create_ticket");
        entry.put("ticket_id", ticketId);
        entry.put("summary", ToolArgs.string(args, "summary", ""));
        entry.put("severity", ToolArgs.string(args, "severity", "normal"));
        world.appendAudit(entry);
        return Map.of("ticket_id", ticketId, "created", true);
    }

    static boolean patchApplied(WorldState world, Map<String, Object> args, Map<String, Object> output) {
        Object recordId = args.get("record_id");
        Object patch = args.get("patch");
        if (recordId == null || !(patch instanceof Map<?, ?> fields)) {
            return false;
        }
        return world.record(recordId.toString())
                .map(record -> fields.entrySet().stream()
                        .allMatch(e -> Objects.equals(record.get(e.getKey().toString()), e.getValue())))
                .orElse(false);
    }

    static boolean paymentCaptured(WorldState world, Map<String, Object> args, Map<String, Object> output) {
        Object orderId = args.get("order_id");
        return orderId != null && world.record(PAYMENT_PREFIX + orderId)
                .map(payment -> "captured".equals(payment.get("status")))
                .orElse(false);
    }
}
