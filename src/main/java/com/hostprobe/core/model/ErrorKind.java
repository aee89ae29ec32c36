package com.hostprobe.core.model;

/**
 * Every failure the engine and the diagnostic operations can report.
 * <p>
 * Validation failures are deterministic for a given policy and input, so callers
 * must not retry them with the same input.
 */
public enum ErrorKind {

    UNAUTHORIZED_COMMAND(true),
    ARGUMENT_REJECTED(true),
    MALFORMED_ARGUMENT(true),
    PATH_OUTSIDE_SANDBOX(true),
    PATH_NOT_FOUND(false),
    PATH_NOT_READABLE(false),
    PATH_NOT_REGULAR_FILE(false),
    INVALID_PATH(true),
    PATH_STAT_FAILED(false),
    TIMEOUT_EXCEEDED(false),
    SPAWN_FAILED(false),
    INVALID_REQUEST(true);

    private final boolean validationFailure;

    ErrorKind(boolean validationFailure) {
        this.validationFailure = validationFailure;
    }

    public boolean isValidationFailure() {
        return validationFailure;
    }
}
