package com.hostprobe.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final HostprobeCommand hostprobeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HostprobeCommand hostprobeCommand, IFactory factory) {
        this.hostprobeCommand = hostprobeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli is skipped
        if (args.length > 0 && "serve".equals(args[0])) {
            return;
        }
        exitCode = HostprobeCommand.commandLine(hostprobeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
