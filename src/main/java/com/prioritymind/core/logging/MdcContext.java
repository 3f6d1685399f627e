package com.prioritymind.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for structured logging of session operations.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId, String operation) {
        MDC.put("sessionId", sessionId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("operation");
    }
}
