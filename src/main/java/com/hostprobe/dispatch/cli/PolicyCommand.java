package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.diagnostics.PolicySummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hostprobe policy
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show the loaded command and path policy")
@Component
public class PolicyCommand implements Runnable {

    private final DiagnosticDispatcher dispatcher;

    public PolicyCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        PolicySummary policy = dispatcher.dispatch(new DiagnosticOperation.DescribePolicy());

        ConsoleOutput.info("Whitelisted commands (" + policy.commands().size() + ")");
        for (var command : policy.commands()) {
            ConsoleOutput.success(command.name() + " (max " + command.maxTimeoutSeconds() + "s)");
            command.rules().forEach(rule -> System.out.println("    - " + rule));
        }
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.field("Sandbox roots", String.join(", ", policy.allowedRoots()));
        ConsoleOutput.field("Secret patterns", String.join(", ", policy.secretPatterns()));
        ConsoleOutput.field("Forbidden characters", policy.forbiddenCharacters());
        ConsoleOutput.field("Max arguments", policy.maxArguments() + " x " + policy.maxArgumentLength() + " chars");
        ConsoleOutput.field("Timeout", policy.defaultTimeoutSeconds() + "s default, "
                + policy.maxTimeoutSeconds() + "s max");
    }
}
