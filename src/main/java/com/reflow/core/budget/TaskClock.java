package com.reflow.core.budget;

import java.time.Duration;

/**
 * Time source of one task. Tool latency and backoff delays go through {@link #pause}, so a
 * virtual clock can account for them without sleeping.
 */
public interface TaskClock {

    /** Milliseconds since an arbitrary origin. */
    long millis();

    void pause(Duration duration);

    /** Simulated time: starts at zero and advances only on {@link #pause}. */
    static TaskClock virtual() {
        return new VirtualTaskClock();
    }

    /** Wall time on the system clock; {@link #pause} sleeps. */
    static TaskClock system() {
        return new SystemTaskClock(java.time.Clock.systemUTC());
    }
}
