package com.hostprobe.core.security;

import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.policy.ArgumentRule;

/**
 * Why a command was refused.
 *
 * @param kind   the error kind
 * @param detail human readable explanation naming the offending token
 * @param rule   the blocklist rule that matched, or {@code null} for global checks
 */
public record Rejection(ErrorKind kind, String detail, ArgumentRule rule) {
}
