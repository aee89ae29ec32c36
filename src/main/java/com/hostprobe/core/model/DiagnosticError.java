package com.hostprobe.core.model;

public record DiagnosticError(ErrorKind kind, String message) {
}
