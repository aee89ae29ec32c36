package com.hostprobe.core.security;

import com.hostprobe.core.model.ErrorKind;

/**
 * A path that could not be resolved or may not be read.
 */
public record PathError(ErrorKind kind, String detail) {
}
