package com.warden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setTask(String planId, String taskId) {
        MDC.put("planId", planId);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void setRequest(String requestId) {
        MDC.put("requestId", requestId);
    }

    public static void clearRequest() {
        MDC.remove("requestId");
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("taskId");
        MDC.remove("requestId");
    }
}
