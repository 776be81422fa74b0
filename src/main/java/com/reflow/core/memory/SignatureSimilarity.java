package com.reflow.core.memory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted exact-match similarity between two signatures, in [0, 1].
 */
public final class SignatureSimilarity {

    static final double TOOL_WEIGHT = 0.3;
    static final double KIND_WEIGHT = 0.3;
    static final double STEP_WEIGHT = 0.2;
    static final double KEYWORD_WEIGHT = 0.1;
    static final double HASH_WEIGHT = 0.1;

    private SignatureSimilarity() {}

    public static double score(FaultSignature query, FaultSignature stored) {
        double score = 0.0;
        if (Objects.equals(query.toolName(), stored.toolName())) {
            score += TOOL_WEIGHT;
        }
        if (Objects.equals(query.errorKind(), stored.errorKind())) {
            score += KIND_WEIGHT;
        }
        if (Objects.equals(query.stepName(), stored.stepName())) {
            score += STEP_WEIGHT;
        }
        score += KEYWORD_WEIGHT * jaccard(query.keywordSet(), stored.keywordSet());
        if (!query.stateHashPrefix().isEmpty() && query.stateHashPrefix().equals(stored.stateHashPrefix())) {
            score += HASH_WEIGHT;
        }
        return Math.min(1.0, score);
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
