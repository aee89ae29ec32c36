package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.model.ProcessSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe ps [--filter pattern] [--limit n]
 */
@Command(name = "ps", mixinStandardHelpOptions = true, description = "Search running processes")
@Component
public class PsCommand implements Callable<Integer> {

    @Option(names = {"-f", "--filter"}, description = "Case-insensitive match on command or command line")
    private String filter;

    @Option(names = {"-l", "--limit"}, description = "Maximum processes to show (1-100, default 20)")
    private Integer limit;

    private final DiagnosticDispatcher dispatcher;

    public PsCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        ProcessReport report = dispatcher.dispatch(new DiagnosticOperation.SearchProcesses(filter, limit));

        if (report.processes().isEmpty()) {
            ConsoleOutput.warn(report.filter() != null
                    ? "No processes found matching '" + report.filter() + "'"
                    : "No processes found");
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Running processes: " + report.processes().size() + " shown of "
                + report.matched() + " matched (limit " + report.limit() + ")");
        System.out.println(ConsoleOutput.RULE);
        System.out.printf("%8s  %-10s  %10s  %s%n", "PID", "USER", "CPU", "COMMAND");
        for (ProcessSummary p : report.processes()) {
            System.out.printf("%8d  %-10s  %10s  %s%n",
                    p.pid(),
                    p.user() == null ? "?" : p.user(),
                    ConsoleOutput.formatDuration(p.cpuMillis()),
                    p.commandLine() != null ? p.commandLine() : p.command());
        }
        return ExitCodes.OK;
    }
}
