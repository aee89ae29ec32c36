package com.hostprobe.core.security;

import com.hostprobe.core.model.ErrorKind;

import java.util.Optional;

/**
 * Result of canonicalizing a requested path and checking it against the sandbox.
 * <p>
 * {@code inSandbox} is computed from {@code canonicalPath} only. When it is false the other
 * flags are reported as false too: nothing outside the sandbox is ever stat'ed.
 */
public record PathResolution(
    String canonicalPath,
    boolean exists,
    boolean isRegularFile,
    boolean readable,
    boolean inSandbox
) {

    /**
     * First failing access check, in order: outside sandbox, not found, not a regular file,
     * not readable. Empty when content may be read.
     */
    public Optional<PathError> accessError() {
        if (!inSandbox) {
            return Optional.of(new PathError(ErrorKind.PATH_OUTSIDE_SANDBOX,
                    "Path " + canonicalPath + " is outside the allowed directories"));
        }
        if (!exists) {
            return Optional.of(new PathError(ErrorKind.PATH_NOT_FOUND, "Path " + canonicalPath + " does not exist"));
        }
        if (!isRegularFile) {
            return Optional.of(new PathError(ErrorKind.PATH_NOT_REGULAR_FILE,
                    "Path " + canonicalPath + " is not a regular file"));
        }
        if (!readable) {
            return Optional.of(new PathError(ErrorKind.PATH_NOT_READABLE, "Path " + canonicalPath + " is not readable"));
        }
        return Optional.empty();
    }

    public boolean isAccessible() {
        return accessError().isEmpty();
    }
}
