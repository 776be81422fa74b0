package com.reflow.core.diagnosis;

/**
 * External reasoning component that classifies a failure and proposes an action.
 * Implementations must not throw; an unusable answer is {@link DiagnosisResponse#malformed}.
 */
public interface DiagnosisCollaborator {

    DiagnosisResponse diagnose(DiagnosisRequest request);
}
