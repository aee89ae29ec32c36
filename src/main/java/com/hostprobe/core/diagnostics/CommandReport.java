package com.hostprobe.core.diagnostics;

import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.security.Rejection;

import java.util.List;

/**
 * Outcome of {@link DiagnosticOperation.RunCommand}: either a rejection (nothing was spawned)
 * or an execution result.
 */
public record CommandReport(
    String command,
    List<String> arguments,
    Rejection rejection,
    ExecutionResult result
) {

    public boolean approved() {
        return rejection == null;
    }

    /**
     * The rejection kind, the timeout/spawn kind, or {@code null} for a completed run.
     */
    public ErrorKind errorKind() {
        if (rejection != null) {
            return rejection.kind();
        }
        return result.errorKind();
    }
}
