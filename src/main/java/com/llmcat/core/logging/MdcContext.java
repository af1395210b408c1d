package com.llmcat.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing llmcat MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, int taskIndex, String source) {
        MDC.put("runId", runId);
        MDC.put("taskIndex", String.valueOf(taskIndex));
        MDC.put("source", source);
    }

    public static void clearTask() {
        MDC.remove("taskIndex");
        MDC.remove("source");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("taskIndex");
        MDC.remove("source");
    }
}
