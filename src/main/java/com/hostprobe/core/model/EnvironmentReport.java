package com.hostprobe.core.model;

import java.util.List;
import java.util.SortedMap;

/**
 * Environment variables of the hostprobe process with secrets masked by key.
 *
 * @param filter      case-insensitive substring filter on the key, or {@code null}
 * @param variables   matching variables sorted by key, secret values replaced by the marker
 * @param count       number of matching variables
 * @param maskedCount how many of them were masked
 * @param pathEntries entries of {@code PATH}, in order
 */
public record EnvironmentReport(
    String filter,
    SortedMap<String, String> variables,
    int count,
    int maskedCount,
    List<String> pathEntries
) {
}
