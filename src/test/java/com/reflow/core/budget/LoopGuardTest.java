package com.reflow.core.budget;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoopGuardTest {

    @Test
    @DisplayName("stalls after the window of failures with an unchanged hash")
    void stallsOnRepeatedHash() {
        LoopGuard guard = new LoopGuard(3);

        guard.recordFailure(1, "h1");
        guard.recordFailure(1, "h1");
        assertFalse(guard.isStalled(1));

        guard.recordFailure(1, "h1");
        assertTrue(guard.isStalled(1));
        assertFalse(guard.isStalled(0));
    }

    @Test
    @DisplayName("a changing hash is progress")
    void changingHashIsProgress() {
        LoopGuard guard = new LoopGuard(3);

        guard.recordFailure(2, "a");
        guard.recordFailure(2, "b");
        guard.recordFailure(2, "b");
        assertFalse(guard.isStalled(2));

        guard.recordFailure(2, "b");
        assertTrue(guard.isStalled(2));
    }

    @Test
    @DisplayName("clear forgets a step's history")
    void clearResets() {
        LoopGuard guard = new LoopGuard(2);
        guard.recordFailure(0, "x");
        guard.recordFailure(0, "x");
        assertTrue(guard.isStalled(0));

        guard.clear(0);

        assertFalse(guard.isStalled(0));
        assertEquals(0, guard.failureCount(0));
    }

    @Test
    @DisplayName("window below two is rejected")
    void windowValidated() {
        assertThrows(IllegalArgumentException.class, () -> new LoopGuard(1));
    }
}
