package com.reflow.core.diagnosis;

import com.reflow.core.model.FaultLayer;

/**
 * Answer of a diagnosis collaborator.
 *
 * @param layer      proposed fault layer, null when the answer was unusable
 * @param action     proposed action
 * @param confidence self-reported confidence in [0, 1]; 0 for an unusable answer
 * @param reasoning  short explanation
 */
public record DiagnosisResponse(FaultLayer layer, DiagnosisAction action, double confidence, String reasoning) {

    /** Unusable answer: confidence 0, which always escalates. */
    public static DiagnosisResponse malformed(String reason) {
        return new DiagnosisResponse(null, DiagnosisAction.ESCALATE, 0.0, "malformed: " + reason);
    }
}
