package com.hostprobe.core.exec;

import com.hostprobe.core.model.ErrorKind;

/**
 * Structured result of a bounded execution.
 *
 * @param exitCode        exit status, {@code null} when the process never started or was killed on timeout
 * @param signal          signal that ended the process, e.g. {@code SIGTERM}, or {@code null}
 * @param stdout          captured standard output, at most the byte cap
 * @param stderr          captured standard error, at most the byte cap
 * @param stdoutTruncated whether stdout bytes were discarded at the cap
 * @param stderrTruncated whether stderr bytes were discarded at the cap
 * @param durationMillis  wall-clock time from spawn attempt to result
 * @param outcome         terminal state
 * @param error           OS error for {@link ExecutionOutcome#SPAWN_FAILED}, otherwise {@code null}
 */
public record ExecutionResult(
    Integer exitCode,
    String signal,
    String stdout,
    String stderr,
    boolean stdoutTruncated,
    boolean stderrTruncated,
    long durationMillis,
    ExecutionOutcome outcome,
    String error
) {

    static ExecutionResult spawnFailed(String error, long durationMillis) {
        return new ExecutionResult(null, null, "", "", false, false, durationMillis,
                ExecutionOutcome.SPAWN_FAILED, error);
    }

    /**
     * {@link ErrorKind} for non-completed outcomes, {@code null} when the process ran to completion.
     */
    public ErrorKind errorKind() {
        return switch (outcome) {
            case COMPLETED -> null;
            case TIMED_OUT -> ErrorKind.TIMEOUT_EXCEEDED;
            case SPAWN_FAILED -> ErrorKind.SPAWN_FAILED;
        };
    }
}
