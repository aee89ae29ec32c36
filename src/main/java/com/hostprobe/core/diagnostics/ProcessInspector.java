package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.model.ProcessSummary;
import com.hostprobe.core.security.SecretMasker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Lists running processes through {@link ProcessHandle}, with command lines masked.
 * Processes whose details the OS hides from this user are skipped.
 */
@Service
public class ProcessInspector {

    static final int MAX_FILTER_LENGTH = 200;

    private final SecretMasker masker;
    private final Supplier<Stream<ProcessHandle>> processes;

    @Autowired
    public ProcessInspector(SecretMasker masker) {
        this(masker, ProcessHandle::allProcesses);
    }

    ProcessInspector(SecretMasker masker, Supplier<Stream<ProcessHandle>> processes) {
        this.masker = masker;
        this.processes = processes;
    }

    public ProcessReport search(DiagnosticOperation.SearchProcesses op) {
        String filter = Params.optionalText("filter", op.filter(), MAX_FILTER_LENGTH);
        int limit = Params.intInRange("limit", op.limit(), 20, 1, 100);
        String needle = filter == null ? null : filter.toLowerCase(Locale.ROOT);

        List<ProcessSummary> matched;
        try (Stream<ProcessHandle> handles = processes.get()) {
            matched = handles
                    .map(this::summarize)
                    .filter(Objects::nonNull)
                    .filter(p -> needle == null || matches(p, needle))
                    .sorted(Comparator.comparingLong(ProcessSummary::cpuMillis).reversed()
                            .thenComparingLong(ProcessSummary::pid))
                    .toList();
        }
        List<ProcessSummary> limited = matched.size() > limit ? matched.subList(0, limit) : matched;
        return new ProcessReport(filter, limit, matched.size(), List.copyOf(limited));
    }

    private ProcessSummary summarize(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        String executable = info.command().orElse(null);
        String commandLine = info.commandLine().map(masker::maskFragment).orElse(null);
        if (executable == null && commandLine == null) {
            return null;
        }
        String command = executable == null ? commandLine : baseName(executable);
        return new ProcessSummary(
                handle.pid(),
                command,
                commandLine,
                info.user().orElse(null),
                info.startInstant().orElse(null),
                info.totalCpuDuration().map(Duration::toMillis).orElse(0L));
    }

    /**
     * Matches against the masked command line so a filter cannot probe for secret values.
     */
    private static boolean matches(ProcessSummary p, String needle) {
        return (p.command() != null && p.command().toLowerCase(Locale.ROOT).contains(needle))
                || (p.commandLine() != null && p.commandLine().toLowerCase(Locale.ROOT).contains(needle));
    }

    private static String baseName(String executable) {
        int slash = Math.max(executable.lastIndexOf('/'), executable.lastIndexOf('\\'));
        return slash >= 0 ? executable.substring(slash + 1) : executable;
    }
}
