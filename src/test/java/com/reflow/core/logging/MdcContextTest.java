package com.reflow.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts taskId and strategy in MDC and drops a stale step")
    void setTask() {
        MdcContext.setStep(4);
        MdcContext.setTask("order-conflict", "B2");

        assertEquals("order-conflict", MDC.get("taskId"));
        assertEquals("B2", MDC.get("strategy"));
        assertNull(MDC.get("stepIndex"));
    }

    @Test
    @DisplayName("setStep puts stepIndex in MDC")
    void setStep() {
        MdcContext.setStep(2);
        assertEquals("2", MDC.get("stepIndex"));
    }

    @Test
    @DisplayName("clear removes all reflow MDC keys")
    void clear() {
        MdcContext.setTask("t", "B4");
        MdcContext.setStep(1);
        MdcContext.clear();

        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("strategy"));
        assertNull(MDC.get("stepIndex"));
    }
}
