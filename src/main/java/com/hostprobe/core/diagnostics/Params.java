package com.hostprobe.core.diagnostics;

/**
 * Parameter checks shared by the diagnostic handlers.
 */
final class Params {

    private Params() {}

    static int intInRange(String name, Integer value, int defaultValue, int min, int max) {
        int v = value == null ? defaultValue : value;
        if (v < min || v > max) {
            throw new InvalidRequestException(name + " must be between " + min + " and " + max + ", got " + v);
        }
        return v;
    }

    /**
     * Blank becomes {@code null}; anything longer than {@code maxLength} is refused.
     */
    static String optionalText(String name, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        if (value.length() > maxLength) {
            throw new InvalidRequestException(name + " must be at most " + maxLength + " characters");
        }
        return value;
    }
}
