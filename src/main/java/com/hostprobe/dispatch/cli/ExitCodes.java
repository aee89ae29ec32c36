package com.hostprobe.dispatch.cli;

import com.hostprobe.core.model.ErrorKind;

/**
 * Process exit codes of the diagnostic subcommands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int REJECTED = 2;
    static final int SPAWN_FAILED = 3;
    static final int TIMED_OUT = 4;

    private ExitCodes() {}

    static int forKind(ErrorKind kind) {
        if (kind == null) {
            return OK;
        }
        return switch (kind) {
            case SPAWN_FAILED -> SPAWN_FAILED;
            case TIMEOUT_EXCEEDED -> TIMED_OUT;
            default -> REJECTED;
        };
    }
}
