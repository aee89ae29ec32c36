package com.hostprobe.core.model;

import java.util.List;

/**
 * The tail of a log file, optionally filtered.
 *
 * @param requestedPath  path as given by the caller
 * @param canonicalPath  resolved path, {@code null} when it could not be resolved
 * @param requestedLines number of trailing lines requested
 * @param filter         case-insensitive substring filter, or {@code null}
 * @param lines          matching lines, oldest first; empty when {@code error} is set
 * @param error          why no content was returned, or {@code null}
 */
public record LogExcerpt(
    String requestedPath,
    String canonicalPath,
    int requestedLines,
    String filter,
    List<String> lines,
    DiagnosticError error
) {
    public LogExcerpt {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static LogExcerpt failed(String requestedPath, String canonicalPath, int requestedLines,
                                    String filter, DiagnosticError error) {
        return new LogExcerpt(requestedPath, canonicalPath, requestedLines, filter, List.of(), error);
    }
}
