package com.hostprobe.core.policy;

import java.nio.file.Path;
import java.util.List;

/**
 * Filesystem sandbox: a requested path is accessible only if its canonical form equals,
 * or is a descendant of, one of the canonical roots.
 */
public record PathPolicy(List<Path> allowedRoots) {

    public PathPolicy {
        allowedRoots = allowedRoots == null ? List.of() : List.copyOf(allowedRoots);
        for (Path root : allowedRoots) {
            if (!root.isAbsolute()) {
                throw new IllegalArgumentException("Sandbox root must be absolute: " + root);
            }
        }
    }

    /**
     * Segment-aware containment: {@code /var/logs-evil} is not inside {@code /var/log}.
     */
    public boolean contains(Path canonicalPath) {
        for (Path root : allowedRoots) {
            if (canonicalPath.startsWith(root)) {
                return true;
            }
        }
        return false;
    }
}
