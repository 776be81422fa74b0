package com.reflow.core.memory;

import com.reflow.core.model.RecoveryAction;

/**
 * Result of a memory lookup.
 *
 * @param action     stored action, null when nothing matched
 * @param confidence 0.7 x similarity + 0.3 x success rate; 0 when nothing matched
 * @param matchedKey key of the matched entry, null when nothing matched
 * @param similarity similarity of the matched entry
 */
public record MemoryMatch(RecoveryAction action, double confidence, String matchedKey, double similarity) {

    private static final MemoryMatch NONE = new MemoryMatch(null, 0.0, null, 0.0);

    public static MemoryMatch none() {
        return NONE;
    }

    public boolean found() {
        return action != null;
    }
}
