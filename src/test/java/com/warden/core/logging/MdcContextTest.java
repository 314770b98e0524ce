package com.warden.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setTask sets plan and task")
    void setTask() {
        MdcContext.setTask("PLAN-2026-0001", "TASK-001");

        assertEquals("PLAN-2026-0001", MDC.get("planId"));
        assertEquals("TASK-001", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearTask keeps the plan")
    void clearTask() {
        MdcContext.setTask("PLAN-2026-0001", "TASK-001");

        MdcContext.clearTask();

        assertEquals("PLAN-2026-0001", MDC.get("planId"));
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("request id is set and cleared independently")
    void request() {
        MdcContext.setPlan("PLAN-2026-0001");
        MdcContext.setRequest("CR-1");
        assertEquals("CR-1", MDC.get("requestId"));

        MdcContext.clearRequest();
        assertNull(MDC.get("requestId"));
        assertEquals("PLAN-2026-0001", MDC.get("planId"));
    }

    @Test
    @DisplayName("clear removes every warden key")
    void clear() {
        MdcContext.setTask("PLAN-2026-0001", "TASK-001");
        MdcContext.setRequest("CR-1");
        MDC.put("other", "kept");

        MdcContext.clear();

        assertNull(MDC.get("planId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("requestId"));
        assertEquals("kept", MDC.get("other"));
    }
}
