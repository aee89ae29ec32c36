package com.hostprobe.core.model;

import java.time.Instant;

/**
 * @param commandLine full command line with secrets masked, or {@code null} when the OS hides it
 * @param cpuMillis   total CPU time consumed, {@code 0} when unknown
 */
public record ProcessSummary(
    long pid,
    String command,
    String commandLine,
    String user,
    Instant startTime,
    long cpuMillis
) {
}
