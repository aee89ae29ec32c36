package com.hostprobe.core.model;

import java.time.Instant;

public record LogFileInfo(
    String path,
    long sizeBytes,
    Instant modified,
    boolean readable,
    boolean inSandbox
) {
}
