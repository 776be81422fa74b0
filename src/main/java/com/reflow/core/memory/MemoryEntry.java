package com.reflow.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflow.core.model.RecoveryAction;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-known action for one signature with its track record. Immutable; updates return a new entry.
 *
 * @param signature stored signature
 * @param action    best-known action
 * @param successes outcomes of {@code action} that ended with the step completing
 * @param total     outcomes of {@code action} observed
 * @param examples  a few past observations, capped
 */
public record MemoryEntry(
        @JsonProperty("signature") FaultSignature signature,
        @JsonProperty("action") RecoveryAction action,
        @JsonProperty("successes") int successes,
        @JsonProperty("total") int total,
        @JsonProperty("examples") List<Example> examples
) {

    public MemoryEntry {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    /**
     * One observed outcome.
     */
    public record Example(
            @JsonProperty("action") RecoveryAction action,
            @JsonProperty("success") boolean success,
            @JsonProperty("keywords") List<String> keywords
    ) {}

    @JsonIgnore
    public double successRate() {
        return total == 0 ? 0.0 : (double) successes / total;
    }

    /**
     * Folds in one outcome. A successful action different from the stored one takes over the
     * entry with a fresh record; a failed different action only leaves an example behind.
     */
    MemoryEntry withOutcome(RecoveryAction observed, boolean success, List<String> keywords, int maxExamples) {
        List<Example> updatedExamples = new ArrayList<>(examples);
        if (updatedExamples.size() < maxExamples) {
            updatedExamples.add(new Example(observed, success, keywords));
        }
        if (observed == action) {
            return new MemoryEntry(signature, action, successes + (success ? 1 : 0), total + 1, updatedExamples);
        }
        if (success) {
            return new MemoryEntry(signature, observed, 1, 1, updatedExamples);
        }
        return new MemoryEntry(signature, action, successes, total, updatedExamples);
    }

    static MemoryEntry first(FaultSignature signature, RecoveryAction action, boolean success) {
        return new MemoryEntry(signature, action, success ? 1 : 0, 1,
                List.of(new Example(action, success, signature.keywords())));
    }
}
