package com.hostprobe.core.policy;

import java.util.List;
import java.util.Objects;

/**
 * Authorization policy for one whitelisted command.
 * <p>
 * Keyed by the exact command name: no path components, no aliasing, no case folding.
 *
 * @param name              bare command name, e.g. {@code ping}
 * @param argumentRules     ordered blocklist rules evaluated against every argument
 * @param maxTimeoutSeconds upper bound for the execution deadline of this command
 */
public record CommandPolicy(
    String name,
    List<ArgumentRule> argumentRules,
    int maxTimeoutSeconds
) {
    public CommandPolicy {
        Objects.requireNonNull(name, "name");
        if (name.isBlank() || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Command name must be a bare executable name: " + name);
        }
        if (maxTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("maxTimeoutSeconds must be positive for " + name);
        }
        argumentRules = argumentRules == null ? List.of() : List.copyOf(argumentRules);
    }

    public <T extends ArgumentRule> List<T> rulesOf(Class<T> type) {
        return argumentRules.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
