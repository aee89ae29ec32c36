package com.hostprobe.core.exec;

/**
 * Terminal state of one execution. Exactly one is reported per call.
 */
public enum ExecutionOutcome {
    COMPLETED,
    TIMED_OUT,
    SPAWN_FAILED
}
