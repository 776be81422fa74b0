package com.reflow.core.model;

/**
 * Summary of one finished task.
 *
 * @param taskId               task identifier
 * @param outcome              terminal outcome
 * @param reason               short reason code (e.g. {@code success_condition_met}, {@code escalated:Conflict})
 * @param attempts             total tool attempts, forward and compensation
 * @param stepsCompleted       forward steps completed
 * @param compensationRequired whether at least one compensation was executed
 * @param consistent           consistency verdict of the final world state
 * @param diagnosisCalls       diagnosis collaborator invocations
 * @param memoryHits           decisions served from the memory bank
 */
public record TaskResult(
        String taskId,
        TaskOutcome outcome,
        String reason,
        int attempts,
        int stepsCompleted,
        boolean compensationRequired,
        boolean consistent,
        int diagnosisCalls,
        int memoryHits
) {

    public boolean handled() {
        return outcome == TaskOutcome.SUCCESS || outcome == TaskOutcome.ESCALATED;
    }
}
