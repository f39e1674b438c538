package com.backlogstore.core.logging;

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
    @DisplayName("setOperation puts operation and taskId in MDC")
    void setOperation() {
        MdcContext.setOperation("update", "TASK-1");
        assertEquals("update", MDC.get("operation"));
        assertEquals("TASK-1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setOperation without a task leaves taskId unset")
    void setOperationWithoutTask() {
        MdcContext.setOperation("reconcile", null);
        assertEquals("reconcile", MDC.get("operation"));
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearBranch removes only the branch")
    void clearBranch() {
        MdcContext.setOperation("reconcile", null);
        MdcContext.setBranch("feature/x");
        assertEquals("feature/x", MDC.get("branch"));

        MdcContext.clearBranch();
        assertNull(MDC.get("branch"));
        assertEquals("reconcile", MDC.get("operation"));
    }

    @Test
    @DisplayName("clear removes all store MDC keys")
    void clear() {
        MdcContext.setOperation("archive", "TASK-2");
        MdcContext.setBranch("main");
        MdcContext.clear();
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("branch"));
    }
}
