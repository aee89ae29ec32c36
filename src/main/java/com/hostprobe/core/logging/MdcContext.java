package com.hostprobe.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing hostprobe-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String OPERATION = "operation";
    public static final String COMMAND = "command";

    private MdcContext() {}

    public static void setRequest(String requestId, String operation) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(OPERATION, operation);
    }

    public static void setCommand(String command) {
        MDC.put(COMMAND, command);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(OPERATION);
        MDC.remove(COMMAND);
    }
}
