package com.hostprobe.core.diagnostics;

import com.hostprobe.core.exec.ExecutionProperties;
import com.hostprobe.core.policy.ArgumentRule;
import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.policy.SecretPattern;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The loaded policy rendered as plain data for display.
 */
public record PolicySummary(
    List<CommandSummary> commands,
    List<String> allowedRoots,
    List<String> secretPatterns,
    String forbiddenCharacters,
    int maxArguments,
    int maxArgumentLength,
    int defaultTimeoutSeconds,
    int maxTimeoutSeconds
) {

    public record CommandSummary(String name, List<String> rules, int maxTimeoutSeconds) {
    }

    static PolicySummary of(PolicyStore store, ExecutionProperties execution) {
        List<CommandSummary> commands = store.commands().values().stream()
                .map(p -> new CommandSummary(p.name(),
                        p.argumentRules().stream().map(ArgumentRule::describe).toList(),
                        p.maxTimeoutSeconds()))
                .toList();
        return new PolicySummary(
                commands,
                store.pathPolicy().allowedRoots().stream().map(Path::toString).toList(),
                store.secretPatterns().stream().map(SecretPattern::glob).toList(),
                store.forbiddenCharacters().stream().map(String::valueOf).collect(Collectors.joining()),
                store.maxArguments(),
                store.maxArgumentLength(),
                execution.getDefaultTimeoutSeconds(),
                execution.getMaxTimeoutSeconds());
    }
}
