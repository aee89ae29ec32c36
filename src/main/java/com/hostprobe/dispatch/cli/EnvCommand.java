package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.model.EnvironmentReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe env [--filter pattern]
 */
@Command(name = "env", mixinStandardHelpOptions = true, description = "Show environment variables with secrets masked")
@Component
public class EnvCommand implements Callable<Integer> {

    static final int MAX_VALUE_DISPLAY = 200;

    @Option(names = {"-f", "--filter"}, description = "Case-insensitive substring filter on variable names")
    private String filter;

    private final DiagnosticDispatcher dispatcher;

    public EnvCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        EnvironmentReport report = dispatcher.dispatch(new DiagnosticOperation.InspectEnvironment(filter));

        ConsoleOutput.info("Environment variables");
        if (report.filter() != null) {
            ConsoleOutput.field("Filter", "'" + report.filter() + "'");
        }
        ConsoleOutput.field("Count", report.count() + " (" + report.maskedCount() + " masked)");
        System.out.println(ConsoleOutput.RULE);
        report.variables().forEach((key, value) -> {
            String shown = value.length() > MAX_VALUE_DISPLAY
                    ? value.substring(0, MAX_VALUE_DISPLAY) + "... (truncated)"
                    : value;
            System.out.println(key + "=" + shown);
        });
        return ExitCodes.OK;
    }
}
