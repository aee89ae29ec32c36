package com.hostprobe.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of whitelisted commands, sandbox roots and secret patterns.
 * <p>
 * Built once at startup and never mutated afterwards, so it is safe to share across
 * concurrent requests without synchronization.
 */
public final class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final Map<String, CommandPolicy> commands;
    private final PathPolicy pathPolicy;
    private final List<SecretPattern> secretPatterns;
    private final Set<Character> forbiddenCharacters;
    private final int maxArguments;
    private final int maxArgumentLength;

    public PolicyStore(Map<String, CommandPolicy> commands,
                       PathPolicy pathPolicy,
                       List<SecretPattern> secretPatterns,
                       Set<Character> forbiddenCharacters,
                       int maxArguments,
                       int maxArgumentLength) {
        if (maxArguments <= 0 || maxArgumentLength <= 0) {
            throw new IllegalArgumentException("Argument limits must be positive");
        }
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
        this.pathPolicy = pathPolicy;
        this.secretPatterns = List.copyOf(secretPatterns);
        this.forbiddenCharacters = Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenCharacters));
        this.maxArguments = maxArguments;
        this.maxArgumentLength = maxArgumentLength;
    }

    /**
     * Builds the store from bound configuration, canonicalizing the sandbox roots.
     */
    public static PolicyStore from(PolicyProperties properties) {
        Map<String, CommandPolicy> commands = new LinkedHashMap<>();
        properties.effectiveCommands().forEach((name, rule) -> commands.put(name, rule.toPolicy(name)));

        List<Path> roots = new ArrayList<>();
        for (String root : properties.getAllowedRoots()) {
            roots.add(canonicalRoot(root));
        }

        List<SecretPattern> patterns = properties.getSecretPatterns().stream()
                .map(SecretPattern::glob)
                .toList();

        Set<Character> forbidden = new LinkedHashSet<>();
        String chars = properties.getForbiddenCharacters();
        if (chars != null) {
            for (char c : chars.toCharArray()) {
                forbidden.add(c);
            }
        }

        var store = new PolicyStore(commands, new PathPolicy(roots), patterns, forbidden,
                properties.getMaxArguments(), properties.getMaxArgumentLength());
        log.info("Policy store loaded: {} command(s), {} sandbox root(s), {} secret pattern(s)",
                commands.size(), roots.size(), patterns.size());
        return store;
    }

    private static Path canonicalRoot(String root) {
        Path path = Path.of(root).toAbsolutePath().normalize();
        if (!Files.isDirectory(path)) {
            log.warn("Sandbox root {} does not exist or is not a directory; keeping it as configured", path);
            return path;
        }
        try {
            return CanonicalPaths.canonicalize(path);
        } catch (IOException e) {
            log.warn("Could not canonicalize sandbox root {}: {}", path, e.getMessage());
            return path;
        }
    }

    /**
     * Exact, case-sensitive lookup. No PATH resolution and no aliasing.
     */
    public Optional<CommandPolicy> commandPolicy(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(name));
    }

    public Set<String> commandNames() {
        return commands.keySet();
    }

    public Map<String, CommandPolicy> commands() {
        return commands;
    }

    public PathPolicy pathPolicy() {
        return pathPolicy;
    }

    public List<SecretPattern> secretPatterns() {
        return secretPatterns;
    }

    public Set<Character> forbiddenCharacters() {
        return forbiddenCharacters;
    }

    public int maxArguments() {
        return maxArguments;
    }

    public int maxArgumentLength() {
        return maxArgumentLength;
    }
}
