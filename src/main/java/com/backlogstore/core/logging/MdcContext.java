package com.backlogstore.core.logging;

import org.slf4j.MDC;

/**
 * Store-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation, String taskId) {
        MDC.put("operation", operation);
        if (taskId != null) {
            MDC.put("taskId", taskId);
        }
    }

    public static void setBranch(String branch) {
        MDC.put("branch", branch);
    }

    public static void clearBranch() {
        MDC.remove("branch");
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("taskId");
        MDC.remove("branch");
    }
}
