package com.specforge.orchestrator.pipeline;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for pipeline logging. Every log line written by a session or
 * worker thread carries the session id, and the file path for workers.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(UUID sessionId) {
        MDC.put("sessionId", sessionId.toString());
    }

    public static void setFile(UUID sessionId, String path) {
        MDC.put("sessionId", sessionId.toString());
        MDC.put("path", path);
    }

    /** Pool threads are reused, so the keys must not leak into the next task. */
    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("path");
    }
}
