package com.reflow.core.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects non-progress: a step that keeps failing while the world-state hash after each
 * attempt stays the same. A success at the step clears its history.
 */
public class LoopGuard {

    private static final Logger log = LoggerFactory.getLogger(LoopGuard.class);

    private final int window;
    private final Map<Integer, List<String>> failureHashes = new HashMap<>();

    public LoopGuard(int window) {
        if (window < 2) {
            throw new IllegalArgumentException("Loop guard window must be at least 2: " + window);
        }
        this.window = window;
    }

    public void recordFailure(int stepIndex, String postAttemptHash) {
        failureHashes.computeIfAbsent(stepIndex, k -> new ArrayList<>()).add(postAttemptHash);
    }

    /**
     * True when the last {@code window} failures at the step all left the same state hash.
     */
    public boolean isStalled(int stepIndex) {
        List<String> history = failureHashes.get(stepIndex);
        if (history == null || history.size() < window) {
            return false;
        }
        String last = history.get(history.size() - 1);
        for (int i = history.size() - window; i < history.size(); i++) {
            if (!last.equals(history.get(i))) {
                return false;
            }
        }
        log.debug("Step {} stalled: {} failures with state {}", stepIndex, window, last);
        return true;
    }

    public int failureCount(int stepIndex) {
        List<String> history = failureHashes.get(stepIndex);
        return history != null ? history.size() : 0;
    }

    public void clear(int stepIndex) {
        failureHashes.remove(stepIndex);
    }
}
