package com.reflow.core.recovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    @Test
    @DisplayName("exponential backoff doubles, then stays at its cap")
    void exponentialIsCapped() {
        RetryBackoff backoff = RetryBackoff.exponential(Duration.ofMillis(100), 3);

        assertEquals(Duration.ofMillis(100), backoff.nextDelay());
        assertEquals(Duration.ofMillis(200), backoff.nextDelay());
        assertEquals(Duration.ofMillis(400), backoff.nextDelay());
        assertEquals(Duration.ofMillis(400), backoff.nextDelay());
        assertEquals(4, backoff.attempts());
    }

    @Test
    @DisplayName("fixed backoff never grows")
    void fixedDelay() {
        RetryBackoff backoff = RetryBackoff.fixed(Duration.ofMillis(50));

        for (int i = 0; i < 5; i++) {
            assertEquals(Duration.ofMillis(50), backoff.nextDelay());
        }
    }

    @Test
    @DisplayName("reset starts the schedule over")
    void resetStartsOver() {
        RetryBackoff backoff = RetryBackoff.exponential(Duration.ofMillis(10), 5);
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertEquals(Duration.ofMillis(10), backoff.nextDelay());
    }

    @Test
    @DisplayName("negative base is rejected")
    void negativeBaseRejected() {
        assertThrows(IllegalArgumentException.class, () -> RetryBackoff.fixed(Duration.ofMillis(-1)));
    }
}
