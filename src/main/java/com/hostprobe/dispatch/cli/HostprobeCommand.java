package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.InvalidRequestException;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for hostprobe.
 * Routes to subcommands: exec, logs, env, ps, net, path, policy, health, serve.
 */
@Command(
        name = "hostprobe",
        mixinStandardHelpOptions = true,
        version = "hostprobe 0.1.0",
        description = "Guarded host diagnostics: whitelisted commands, sandboxed logs, masked environment",
        subcommands = {
                ExecCommand.class,
                LogsCommand.class,
                EnvCommand.class,
                PsCommand.class,
                NetCommand.class,
                PathCommand.class,
                PolicyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HostprobeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }

    /**
     * Builds the command line with the shared handler that turns invalid parameters into
     * exit code {@code 2} instead of a stack trace.
     */
    public static CommandLine commandLine(HostprobeCommand command, CommandLine.IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof InvalidRequestException) {
                        ConsoleOutput.error("Invalid request: " + ex.getMessage());
                        return ExitCodes.REJECTED;
                    }
                    throw ex;
                });
    }
}
