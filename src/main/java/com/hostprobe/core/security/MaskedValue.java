package com.hostprobe.core.security;

/**
 * A value after secret masking.
 *
 * @param value     the original value, or the redaction marker when masked
 * @param wasMasked whether the key matched a secret pattern
 */
public record MaskedValue(String value, boolean wasMasked) {
}
