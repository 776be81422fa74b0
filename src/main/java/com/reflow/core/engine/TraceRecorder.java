package com.reflow.core.engine;

import com.reflow.core.trace.TraceEvent;
import com.reflow.core.trace.TraceSink;

/**
 * Stamps sequence number, strategy code and task id on the events of one task.
 * Sequence numbers start at zero for every task.
 */
class TraceRecorder {

    private final TraceSink sink;
    private final String strategy;
    private final String taskId;
    private long nextSeq;

    TraceRecorder(TraceSink sink, String strategy, String taskId) {
        this.sink = sink;
        this.strategy = strategy;
        this.taskId = taskId;
    }

    TraceEvent emit(TraceEvent.Builder builder) {
        TraceEvent event = builder.build(nextSeq++, strategy, taskId);
        sink.append(event);
        return event;
    }
}
