package com.reflow.core.trace;

import java.util.ArrayList;
import java.util.List;

public class InMemoryTraceSink implements TraceSink {

    private final List<TraceEvent> events = new ArrayList<>();

    @Override
    public synchronized void append(TraceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized List<TraceEvent> events() {
        return List.copyOf(events);
    }
}
