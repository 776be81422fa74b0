package com.reflow.core.recovery;

import com.reflow.core.model.FaultKind;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.StepError;

/**
 * Maps an observed error kind to a layer. Only the kind is used; a schedule's layer
 * override is invisible here.
 */
public final class FaultClassifier {

    private FaultClassifier() {}

    public static FaultLayer classify(String errorKind) {
        if (StepError.POST_CONDITION_VIOLATED.equals(errorKind)) {
            return FaultLayer.SEMANTIC;
        }
        FaultKind kind = FaultKind.lookup(errorKind);
        return kind != null ? kind.layer() : FaultLayer.PERSISTENT;
    }

    public static boolean isConflictLike(String errorKind) {
        FaultKind kind = FaultKind.lookup(errorKind);
        return kind != null && kind.isConflictLike();
    }
}
