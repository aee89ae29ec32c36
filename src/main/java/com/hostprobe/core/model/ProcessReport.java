package com.hostprobe.core.model;

import java.util.List;

/**
 * @param matched   number of processes that matched before the limit was applied
 * @param processes at most {@code limit} processes, highest CPU time first
 */
public record ProcessReport(
    String filter,
    int limit,
    int matched,
    List<ProcessSummary> processes
) {
}
