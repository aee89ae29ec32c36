package com.hostprobe.core.policy;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Case-insensitive glob over key names. {@code *} matches any substring, {@code ?} a single
 * character; everything else is literal.
 */
public final class SecretPattern {

    private final String glob;
    private final Pattern compiled;

    private SecretPattern(String glob, Pattern compiled) {
        this.glob = glob;
        this.compiled = compiled;
    }

    public static SecretPattern glob(String glob) {
        Objects.requireNonNull(glob, "glob");
        String upper = glob.trim().toUpperCase(Locale.ROOT);
        if (upper.isEmpty()) {
            throw new IllegalArgumentException("Secret pattern must not be blank");
        }
        var regex = new StringBuilder();
        var literal = new StringBuilder();
        for (char c : upper.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return new SecretPattern(upper, Pattern.compile(regex.toString(), Pattern.DOTALL));
    }

    public boolean matches(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        return compiled.matcher(key.toUpperCase(Locale.ROOT)).matches();
    }

    public String glob() {
        return glob;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SecretPattern other && glob.equals(other.glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return glob;
    }
}
