package com.hostprobe.core.exec;

import com.hostprobe.core.security.Approval;

import java.util.List;
import java.util.Objects;

/**
 * A command ready to run. The only way to build one is from an {@link Approval}, which in turn
 * only the authorizer can issue.
 */
public final class ExecutionRequest {

    private final Approval approval;
    private final int timeoutSeconds;
    private final int maxOutputBytes;

    private ExecutionRequest(Approval approval, int timeoutSeconds, int maxOutputBytes) {
        this.approval = approval;
        this.timeoutSeconds = timeoutSeconds;
        this.maxOutputBytes = maxOutputBytes;
    }

    /**
     * @throws IllegalArgumentException when a limit is not positive or the timeout exceeds the
     *                                  command's own maximum
     */
    public static ExecutionRequest of(Approval approval, int timeoutSeconds, int maxOutputBytes) {
        Objects.requireNonNull(approval, "approval");
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive: " + maxOutputBytes);
        }
        int commandMax = approval.policy().maxTimeoutSeconds();
        if (timeoutSeconds > commandMax) {
            throw new IllegalArgumentException("timeoutSeconds " + timeoutSeconds
                    + " exceeds the maximum of " + commandMax + " for " + approval.command());
        }
        return new ExecutionRequest(approval, timeoutSeconds, maxOutputBytes);
    }

    public String command() { return approval.command(); }
    public List<String> arguments() { return approval.args(); }
    public int timeoutSeconds() { return timeoutSeconds; }
    public int maxOutputBytes() { return maxOutputBytes; }

    @Override
    public String toString() {
        return "ExecutionRequest[" + approval.command() + ", timeout=" + timeoutSeconds
                + "s, maxOutputBytes=" + maxOutputBytes + "]";
    }
}
