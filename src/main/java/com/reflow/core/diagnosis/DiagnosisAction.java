package com.reflow.core.diagnosis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.reflow.core.model.RecoveryAction;

import java.util.Locale;

/**
 * Action vocabulary of the diagnosis contract.
 */
public enum DiagnosisAction {
    RETRY(RecoveryAction.RETRY),
    ROLLBACK(RecoveryAction.ROLLBACK_THEN_RETRY),
    COMPENSATE(RecoveryAction.COMPENSATE_THEN_ESCALATE),
    ESCALATE(RecoveryAction.ESCALATE);

    private final RecoveryAction recoveryAction;

    DiagnosisAction(RecoveryAction recoveryAction) {
        this.recoveryAction = recoveryAction;
    }

    public RecoveryAction toRecoveryAction() {
        return recoveryAction;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DiagnosisAction fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Diagnosis action must not be null");
        }
        return DiagnosisAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
