package com.asyncreview.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AsyncReview-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        if (sessionId != null) {
            MDC.put("sessionId", sessionId);
        }
    }

    public static void setRun(String sessionId, String traceId) {
        setSession(sessionId);
        MDC.put("traceId", traceId);
    }

    public static void setIteration(int iteration) {
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("traceId");
        MDC.remove("iteration");
    }
}
