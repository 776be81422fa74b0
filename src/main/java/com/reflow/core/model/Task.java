package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflow.core.world.WorldState;

import java.util.List;

/**
 * A benchmark task: a fixed workflow, its starting world, its fault schedule and its success predicate.
 *
 * @param taskId            unique task identifier
 * @param initialWorldState world the task starts from; the runner always works on a deep copy
 * @param steps             ordered workflow steps
 * @param faultSchedule     faults to inject, forward and compensation phase
 * @param successCondition  predicate evaluated after the last step
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("initial_world_state") WorldState initialWorldState,
        @JsonProperty("steps") List<StepDefinition> steps,
        @JsonProperty("fault_injections") List<FaultSpec> faultSchedule,
        @JsonProperty("success_condition") SuccessCondition successCondition
) {

    public Task {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("task_id is required");
        }
        if (initialWorldState == null) {
            initialWorldState = new WorldState();
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        faultSchedule = faultSchedule == null ? List.of() : List.copyOf(faultSchedule);
    }
}
