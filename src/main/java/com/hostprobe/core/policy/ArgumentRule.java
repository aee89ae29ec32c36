package com.hostprobe.core.policy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single blocklist rule attached to a {@link CommandPolicy}.
 * <p>
 * Four variants exist. They are evaluated by the authorizer in a fixed order for every
 * argument token: exact match, short-flag cluster decomposition, prefix match, and finally
 * contiguous multi-token subcommand match.
 */
public interface ArgumentRule {

    enum Kind { EXACT, CHAR_CLUSTER, PREFIX, SUBCOMMAND }

    Kind kind();

    /**
     * Human readable form used in rejection details, e.g. {@code ExactBlock("-f")}.
     */
    String describe();

    /** Rejects a token that equals {@code token} verbatim. */
    record ExactBlock(String token) implements ArgumentRule {
        public ExactBlock {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public Kind kind() {
            return Kind.EXACT;
        }

        @Override
        public String describe() {
            return "ExactBlock(\"" + token + "\")";
        }
    }

    /** Rejects any token that starts with {@code prefix}. */
    record PrefixBlock(String prefix) implements ArgumentRule {
        public PrefixBlock {
            Objects.requireNonNull(prefix, "prefix");
            if (prefix.isEmpty()) {
                throw new IllegalArgumentException("PrefixBlock prefix must not be empty");
            }
        }

        @Override
        public Kind kind() {
            return Kind.PREFIX;
        }

        @Override
        public String describe() {
            return "PrefixBlock(\"" + prefix + "\")";
        }
    }

    /**
     * Rejects a contiguous run of tokens, e.g. {@code netns exec}. Each argument may be an
     * abbreviation of the blocked word, the way {@code ip} accepts {@code l s} for
     * {@code link set}.
     */
    record SubcommandBlock(List<String> tokens) implements ArgumentRule {
        public SubcommandBlock {
            Objects.requireNonNull(tokens, "tokens");
            if (tokens.isEmpty()) {
                throw new IllegalArgumentException("SubcommandBlock needs at least one token");
            }
            tokens = List.copyOf(tokens);
        }

        /**
         * Parses the space separated configuration form ({@code "netns exec"}).
         */
        public static SubcommandBlock of(String sequence) {
            return new SubcommandBlock(Arrays.stream(sequence.trim().split("\\s+"))
                    .filter(s -> !s.isEmpty())
                    .toList());
        }

        /**
         * Returns true when {@code args} contains this sequence, possibly abbreviated, starting at {@code index}.
         */
        public boolean matchesAt(List<String> args, int index) {
            if (index + tokens.size() > args.size()) {
                return false;
            }
            for (int i = 0; i < tokens.size(); i++) {
                String arg = args.get(index + i);
                if (arg.isEmpty() || !tokens.get(i).startsWith(arg)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Kind kind() {
            return Kind.SUBCOMMAND;
        }

        @Override
        public String describe() {
            return "SubcommandBlock(\"" + String.join(" ", tokens) + "\")";
        }
    }

    /**
     * Bans single characters inside short-flag clusters, so banning {@code f}
     * catches {@code -f}, {@code -cf} and {@code -fc}.
     */
    record CharClusterBlock(Set<Character> characters) implements ArgumentRule {
        public CharClusterBlock {
            Objects.requireNonNull(characters, "characters");
            characters = Collections.unmodifiableSet(new LinkedHashSet<>(characters));
        }

        public static CharClusterBlock of(String chars) {
            Set<Character> set = new LinkedHashSet<>();
            for (char c : chars.toCharArray()) {
                if (!Character.isWhitespace(c) && c != ',') {
                    set.add(c);
                }
            }
            return new CharClusterBlock(set);
        }

        public boolean bans(char c) {
            return characters.contains(c);
        }

        @Override
        public Kind kind() {
            return Kind.CHAR_CLUSTER;
        }

        @Override
        public String describe() {
            return "CharClusterBlock(" + characters.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(",", "{", "}")) + ")";
        }
    }
}
