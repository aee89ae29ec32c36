package com.hostprobe.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static configuration the {@link PolicyStore} is built from.
 *
 * <pre>
 * hostprobe:
 *   policy:
 *     include-default-commands: true
 *     allowed-roots: [/var/log, /srv/app/logs]
 *     commands:
 *       journalctl:
 *         exact-blocks: [--vacuum-size, --rotate]
 *         prefix-blocks: [--vacuum]
 *         char-cluster-blocks: "f"
 *         max-timeout-seconds: 60
 * </pre>
 *
 * Entries under {@code commands} are added to the built-in whitelist, replacing a built-in
 * entry of the same name.
 */
@Component
@ConfigurationProperties(prefix = "hostprobe.policy")
public class PolicyProperties {

    private boolean includeDefaultCommands = true;
    private Map<String, CommandRule> commands = new LinkedHashMap<>();
    private List<String> allowedRoots = new ArrayList<>(DefaultPolicies.ALLOWED_ROOTS);
    private List<String> secretPatterns = new ArrayList<>(DefaultPolicies.SECRET_PATTERNS);
    private String forbiddenCharacters = DefaultPolicies.FORBIDDEN_CHARACTERS;
    private int maxArguments = 20;
    private int maxArgumentLength = 1024;

    public boolean isIncludeDefaultCommands() { return includeDefaultCommands; }
    public void setIncludeDefaultCommands(boolean includeDefaultCommands) { this.includeDefaultCommands = includeDefaultCommands; }
    public Map<String, CommandRule> getCommands() { return commands; }
    public void setCommands(Map<String, CommandRule> commands) { this.commands = commands; }
    public List<String> getAllowedRoots() { return allowedRoots; }
    public void setAllowedRoots(List<String> allowedRoots) { this.allowedRoots = allowedRoots; }
    public List<String> getSecretPatterns() { return secretPatterns; }
    public void setSecretPatterns(List<String> secretPatterns) { this.secretPatterns = secretPatterns; }
    public String getForbiddenCharacters() { return forbiddenCharacters; }
    public void setForbiddenCharacters(String forbiddenCharacters) { this.forbiddenCharacters = forbiddenCharacters; }
    public int getMaxArguments() { return maxArguments; }
    public void setMaxArguments(int maxArguments) { this.maxArguments = maxArguments; }
    public int getMaxArgumentLength() { return maxArgumentLength; }
    public void setMaxArgumentLength(int maxArgumentLength) { this.maxArgumentLength = maxArgumentLength; }

    /**
     * Returns the built-in whitelist (when enabled) overlaid with the configured commands.
     */
    public Map<String, CommandRule> effectiveCommands() {
        Map<String, CommandRule> merged = new LinkedHashMap<>();
        if (includeDefaultCommands) {
            merged.putAll(DefaultPolicies.commands());
        }
        if (commands != null) {
            merged.putAll(commands);
        }
        return merged;
    }

    public static class CommandRule {
        private List<String> exactBlocks = new ArrayList<>();
        private List<String> prefixBlocks = new ArrayList<>();
        private List<String> subcommandBlocks = new ArrayList<>();
        private String charClusterBlocks = "";
        private int maxTimeoutSeconds = 300;

        public List<String> getExactBlocks() { return exactBlocks; }
        public void setExactBlocks(List<String> exactBlocks) { this.exactBlocks = exactBlocks; }
        public List<String> getPrefixBlocks() { return prefixBlocks; }
        public void setPrefixBlocks(List<String> prefixBlocks) { this.prefixBlocks = prefixBlocks; }
        public List<String> getSubcommandBlocks() { return subcommandBlocks; }
        public void setSubcommandBlocks(List<String> subcommandBlocks) { this.subcommandBlocks = subcommandBlocks; }
        public String getCharClusterBlocks() { return charClusterBlocks; }
        public void setCharClusterBlocks(String charClusterBlocks) { this.charClusterBlocks = charClusterBlocks; }
        public int getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
        public void setMaxTimeoutSeconds(int maxTimeoutSeconds) { this.maxTimeoutSeconds = maxTimeoutSeconds; }

        public CommandRule exact(String... tokens) {
            exactBlocks.addAll(List.of(tokens));
            return this;
        }

        public CommandRule prefix(String... prefixes) {
            prefixBlocks.addAll(List.of(prefixes));
            return this;
        }

        public CommandRule subcommand(String... sequences) {
            subcommandBlocks.addAll(List.of(sequences));
            return this;
        }

        public CommandRule cluster(String chars) {
            charClusterBlocks = chars;
            return this;
        }

        /**
         * Converts the bound configuration into the immutable policy form.
         */
        public CommandPolicy toPolicy(String name) {
            List<ArgumentRule> rules = new ArrayList<>();
            if (exactBlocks != null) {
                exactBlocks.forEach(t -> rules.add(new ArgumentRule.ExactBlock(t)));
            }
            if (charClusterBlocks != null && !charClusterBlocks.isBlank()) {
                rules.add(ArgumentRule.CharClusterBlock.of(charClusterBlocks));
            }
            if (prefixBlocks != null) {
                prefixBlocks.forEach(p -> rules.add(new ArgumentRule.PrefixBlock(p)));
            }
            if (subcommandBlocks != null) {
                subcommandBlocks.forEach(s -> rules.add(ArgumentRule.SubcommandBlock.of(s)));
            }
            return new CommandPolicy(name, rules, maxTimeoutSeconds);
        }
    }
}
