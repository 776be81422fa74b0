package com.reflow.core.budget;

import java.time.Duration;

class VirtualTaskClock implements TaskClock {

    private long now;

    @Override
    public long millis() {
        return now;
    }

    @Override
    public void pause(Duration duration) {
        if (!duration.isNegative()) {
            now += duration.toMillis();
        }
    }
}
