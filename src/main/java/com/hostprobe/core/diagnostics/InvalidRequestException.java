package com.hostprobe.core.diagnostics;

/**
 * A diagnostic operation was called with parameters outside their documented range.
 * Surfaces report it as {@code INVALID_REQUEST}.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
