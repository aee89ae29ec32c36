package com.hostprobe.core.security;

import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.policy.SecretPattern;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts secrets from key/value pairs and free-text fragments such as process command lines.
 * <p>
 * Decisions are made on key names only. A masked value is always replaced by the same
 * fixed-length marker, and the marker never matches a pattern, so masking is idempotent.
 * Masking never fails: unmatched input is returned unchanged.
 */
@Service
public class SecretMasker {

    public static final String MARKER = "********";

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    /**
     * Matches credentials embedded in URLs.
     */
    private static final Pattern URL_USERINFO = Pattern.compile(
            "([A-Za-z][A-Za-z0-9+.-]*://)([^:/@\\s]+):([^@\\s]+)@"
    );

    private final List<SecretPattern> patterns;

    public SecretMasker(PolicyStore policyStore) {
        this(policyStore.secretPatterns());
    }

    SecretMasker(List<SecretPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public MaskedValue mask(String key, String value) {
        if (isSensitiveKey(key)) {
            return new MaskedValue(MARKER, true);
        }
        return new MaskedValue(value == null ? "" : value, false);
    }

    /**
     * Masks every entry of an environment-like map, returned sorted by key.
     */
    public SortedMap<String, MaskedValue> maskAll(Map<String, String> values) {
        if (values == null) {
            return Collections.emptySortedMap();
        }
        SortedMap<String, MaskedValue> masked = new TreeMap<>();
        values.forEach((k, v) -> masked.put(k, mask(k, v)));
        return masked;
    }

    /**
     * Masks secrets in free text while keeping its whitespace layout. Handles {@code key=value}
     * tokens, a secret flag followed by its value ({@code --password hunter2}), URL userinfo
     * and {@code Bearer} tokens.
     */
    public String maskFragment(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        var out = new StringBuilder(text.length());
        Matcher m = TOKEN.matcher(text);
        int last = 0;
        String previous = null;
        while (m.find()) {
            out.append(text, last, m.start());
            String token = m.group();
            out.append(maskToken(previous, token));
            previous = token;
            last = m.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    /**
     * Tests a key against the secret patterns. Leading dashes are stripped and a {@code -D}
     * system property prefix is tolerated, so {@code -Dpassword} and {@code --api-key} count as keys.
     */
    public boolean isSensitiveKey(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        String stripped = stripDashes(key.trim());
        if (matchesAny(stripped)) {
            return true;
        }
        return key.startsWith("-D") && stripped.length() > 1 && matchesAny(stripped.substring(1));
    }

    private String maskToken(String previous, String token) {
        if (previous != null && !token.startsWith("-")) {
            if ("Bearer".equalsIgnoreCase(previous) || isSecretFlag(previous)) {
                return MARKER;
            }
        }
        int eq = token.indexOf('=');
        if (eq > 0 && isSensitiveKey(token.substring(0, eq))) {
            return token.substring(0, eq + 1) + MARKER;
        }
        return URL_USERINFO.matcher(token).replaceAll("$1$2:" + Matcher.quoteReplacement(MARKER) + "@");
    }

    private boolean isSecretFlag(String token) {
        return token.startsWith("-") && token.indexOf('=') < 0 && isSensitiveKey(token);
    }

    private boolean matchesAny(String key) {
        for (SecretPattern pattern : patterns) {
            if (pattern.matches(key)) {
                return true;
            }
        }
        return false;
    }

    private static String stripDashes(String key) {
        int i = 0;
        while (i < key.length() && key.charAt(i) == '-') {
            i++;
        }
        return key.substring(i);
    }
}
