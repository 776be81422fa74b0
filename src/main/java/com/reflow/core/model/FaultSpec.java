package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a task's fault schedule.
 *
 * @param stepIndex     forward step the fault targets (also the owning step of a compensation target)
 * @param kind          fault kind to surface
 * @param probability   chance in [0, 1] that the fault fires when rolled
 * @param faultId       stable id, part of the injection seed
 * @param layerOverride optional layer reported instead of the kind's ground truth
 * @param mode          behaviour across repeated attempts
 * @param scenario      free-form label carried into the trace
 * @param phase         forward step or compensation call
 * @param tool          compensating tool name when {@code phase} is {@link FaultPhase#COMPENSATION}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FaultSpec(
        @JsonProperty("step_idx") int stepIndex,
        @JsonProperty("fault_type") FaultKind kind,
        @JsonProperty("prob") Double probability,
        @JsonProperty("fault_id") String faultId,
        @JsonProperty("layer_override") FaultLayer layerOverride,
        @JsonProperty("mode") FaultMode mode,
        @JsonProperty("scenario") String scenario,
        @JsonProperty("phase") FaultPhase phase,
        @JsonProperty("tool") String tool
) {

    public FaultSpec {
        if (kind == null) {
            throw new IllegalArgumentException("fault_type is required");
        }
        if (probability == null) {
            probability = 1.0;
        }
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("prob must be within [0, 1]: " + probability);
        }
        if (faultId == null || faultId.isBlank()) {
            faultId = "f" + stepIndex + "-" + kind.wireName();
        }
        if (mode == null) {
            mode = FaultMode.ONCE;
        }
        if (phase == null) {
            phase = FaultPhase.FORWARD;
        }
        if (phase == FaultPhase.COMPENSATION && (tool == null || tool.isBlank())) {
            throw new IllegalArgumentException("Compensation-phase fault " + faultId + " needs a tool name");
        }
    }

    /** Convenience factory for a forward fault that always fires. */
    public static FaultSpec forward(int stepIndex, FaultKind kind, FaultMode mode) {
        return new FaultSpec(stepIndex, kind, 1.0, null, null, mode, null, FaultPhase.FORWARD, null);
    }

    /** Convenience factory for a fault against a compensating call. */
    public static FaultSpec compensation(int owningStepIndex, String tool, FaultKind kind) {
        return new FaultSpec(owningStepIndex, kind, 1.0, null, null, FaultMode.PERSISTENT, null,
                FaultPhase.COMPENSATION, tool);
    }

    /** Layer that an injected fault of this entry reports. */
    public FaultLayer effectiveLayer() {
        return layerOverride != null ? layerOverride : kind.layer();
    }
}
