package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.CommandReport;
import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe exec &lt;command&gt; [-- args...]
 * <p>
 * Runs a whitelisted diagnostic command. Arguments that start with a dash must follow
 * {@code --} so picocli passes them through untouched.
 */
@Command(name = "exec", mixinStandardHelpOptions = true,
        description = "Run a whitelisted diagnostic command (e.g. exec ping -- -c 3 example.com)")
@Component
public class ExecCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Whitelisted command name")
    private String command;

    @Parameters(index = "1..*", arity = "0..*", description = "Command arguments")
    private List<String> arguments = new ArrayList<>();

    @Option(names = {"-t", "--timeout"}, description = "Timeout in seconds (default: configured default)")
    private Integer timeoutSeconds;

    private final DiagnosticDispatcher dispatcher;

    public ExecCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        CommandReport report = dispatcher.dispatch(
                new DiagnosticOperation.RunCommand(command, arguments, timeoutSeconds));

        if (!report.approved()) {
            ConsoleOutput.rejection(report.rejection());
            return ExitCodes.forKind(report.errorKind());
        }

        ConsoleOutput.info("$ " + command + (arguments.isEmpty() ? "" : " " + String.join(" ", arguments)));
        ConsoleOutput.execution(report.result());
        return ExitCodes.forKind(report.errorKind());
    }
}
