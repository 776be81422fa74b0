package com.reflow.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for per-task structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String strategy) {
        MDC.put("taskId", taskId);
        MDC.put("strategy", strategy);
        MDC.remove("stepIndex");
    }

    public static void setStep(int stepIndex) {
        MDC.put("stepIndex", String.valueOf(stepIndex));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("strategy");
        MDC.remove("stepIndex");
    }
}
