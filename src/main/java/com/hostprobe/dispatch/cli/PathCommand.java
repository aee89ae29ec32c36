package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.security.PathCheck;
import com.hostprobe.core.security.PathError;
import com.hostprobe.core.security.PathResolution;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe path &lt;path&gt;
 * <p>
 * Shows how a path resolves against the sandbox without reading it.
 */
@Command(name = "path", mixinStandardHelpOptions = true, description = "Check a path against the sandbox")
@Component
public class PathCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to check")
    private String path;

    private final DiagnosticDispatcher dispatcher;

    public PathCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        PathCheck check = dispatcher.dispatch(new DiagnosticOperation.CheckPath(path));
        if (!check.isResolved()) {
            ConsoleOutput.error(check.error().kind() + ": " + check.error().detail());
            return ExitCodes.forKind(check.error().kind());
        }

        PathResolution resolution = check.resolution();
        ConsoleOutput.info("Path: " + path);
        ConsoleOutput.field("Canonical", resolution.canonicalPath());
        ConsoleOutput.field("In sandbox", resolution.inSandbox());
        ConsoleOutput.field("Exists", resolution.exists());
        ConsoleOutput.field("Regular file", resolution.isRegularFile());
        ConsoleOutput.field("Readable", resolution.readable());

        PathError error = check.accessError();
        if (error != null) {
            ConsoleOutput.error(error.kind() + ": " + error.detail());
            return ExitCodes.forKind(error.kind());
        }
        ConsoleOutput.success("Accessible");
        return ExitCodes.OK;
    }
}
