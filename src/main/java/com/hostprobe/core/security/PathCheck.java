package com.hostprobe.core.security;

/**
 * Outcome of {@link PathSandboxResolver#resolve}: a resolution, or an error when the path could
 * not be canonicalized at all.
 */
public record PathCheck(PathResolution resolution, PathError error) {

    public PathCheck {
        if ((resolution == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of resolution or error must be present");
        }
    }

    public static PathCheck of(PathResolution resolution) {
        return new PathCheck(resolution, null);
    }

    public static PathCheck failed(PathError error) {
        return new PathCheck(null, error);
    }

    public boolean isResolved() {
        return resolution != null;
    }

    /**
     * The error that prevents reading content: the resolution failure itself, or the first
     * failing access check.
     */
    public PathError accessError() {
        if (error != null) {
            return error;
        }
        return resolution.accessError().orElse(null);
    }
}
