package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.model.LogExcerpt;
import com.hostprobe.core.model.LogFileInfo;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe logs [path]
 * <p>
 * Tails a log file inside the sandbox, or lists the common log locations when no path is given.
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "Tail a sandboxed log file or list common logs")
@Component
public class LogsCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Log file path")
    private String path;

    @Option(names = {"-n", "--lines"}, description = "Number of trailing lines (1-1000, default 50)")
    private Integer lines;

    @Option(names = {"-g", "--grep"}, description = "Case-insensitive substring filter")
    private String filter;

    private final DiagnosticDispatcher dispatcher;

    public LogsCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        if (path == null) {
            return listCommon();
        }

        LogExcerpt excerpt = dispatcher.dispatch(new DiagnosticOperation.ReadLog(path, lines, filter));
        if (excerpt.error() != null) {
            ConsoleOutput.error(excerpt.error().kind() + ": " + excerpt.error().message());
            return ExitCodes.forKind(excerpt.error().kind());
        }

        ConsoleOutput.info("Log file: " + excerpt.canonicalPath());
        ConsoleOutput.field("Lines", excerpt.lines().size() + " (last " + excerpt.requestedLines() + " requested)");
        if (excerpt.filter() != null) {
            ConsoleOutput.field("Filtered by", "'" + excerpt.filter() + "'");
        }
        System.out.println(ConsoleOutput.RULE);
        if (excerpt.lines().isEmpty()) {
            ConsoleOutput.warn(excerpt.filter() != null
                    ? "No matching entries found for '" + excerpt.filter() + "'"
                    : "Log file is empty");
        }
        excerpt.lines().forEach(System.out::println);
        return ExitCodes.OK;
    }

    private int listCommon() {
        List<LogFileInfo> logs = dispatcher.dispatch(new DiagnosticOperation.ListLogs());
        ConsoleOutput.info("Common log file locations");
        if (logs.isEmpty()) {
            ConsoleOutput.warn("No common log files found on this system");
            return ExitCodes.OK;
        }
        for (LogFileInfo info : logs) {
            String label = info.path() + " (" + ConsoleOutput.formatBytes(info.sizeBytes())
                    + (info.modified() != null ? ", modified " + info.modified() : "") + ")";
            if (info.readable()) {
                ConsoleOutput.success(label);
            } else {
                ConsoleOutput.error(label + " not readable");
            }
        }
        return ExitCodes.OK;
    }
}
