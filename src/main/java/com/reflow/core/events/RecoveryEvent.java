package com.reflow.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while tasks run, used by the CLI watch mode.
 *
 * @param eventType event type (e.g. "task.started", "step.failed", "recovery.decided", "task.finished")
 * @param taskId    the task this event belongs to
 * @param stepIndex the step this event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RecoveryEvent(
        String eventType,
        String taskId,
        Integer stepIndex,
        Map<String, Object> payload,
        Instant timestamp
) {

    public static RecoveryEvent of(String eventType, String taskId, Integer stepIndex, Map<String, Object> payload) {
        return new RecoveryEvent(eventType, taskId, stepIndex, payload, Instant.now());
    }
}
