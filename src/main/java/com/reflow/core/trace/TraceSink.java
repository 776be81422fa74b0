package com.reflow.core.trace;

import java.util.List;

/**
 * Append-only destination of trace events.
 */
public interface TraceSink {

    void append(TraceEvent event);

    /** Events appended so far, in order. */
    List<TraceEvent> events();
}
