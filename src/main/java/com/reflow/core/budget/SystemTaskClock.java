package com.reflow.core.budget;

import java.time.Clock;
import java.time.Duration;

class SystemTaskClock implements TaskClock {

    private final Clock clock;

    SystemTaskClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long millis() {
        return clock.millis();
    }

    @Override
    public void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pausing " + duration.toMillis() + "ms", e);
        }
    }
}
