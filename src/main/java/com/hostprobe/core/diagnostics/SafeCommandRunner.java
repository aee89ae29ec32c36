package com.hostprobe.core.diagnostics;

import com.hostprobe.core.exec.BoundedExecutor;
import com.hostprobe.core.exec.ExecutionProperties;
import com.hostprobe.core.exec.ExecutionRequest;
import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.logging.MdcContext;
import com.hostprobe.core.security.Approval;
import com.hostprobe.core.security.Authorization;
import com.hostprobe.core.security.CommandAuthorizer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Authorize-then-execute for a single whitelisted command. A rejected command never reaches
 * the executor.
 */
@Service
public class SafeCommandRunner {

    private final CommandAuthorizer authorizer;
    private final BoundedExecutor executor;
    private final ExecutionProperties properties;

    public SafeCommandRunner(CommandAuthorizer authorizer, BoundedExecutor executor, ExecutionProperties properties) {
        this.authorizer = authorizer;
        this.executor = executor;
        this.properties = properties;
    }

    public CommandReport run(DiagnosticOperation.RunCommand op) {
        List<String> args = op.arguments();
        if (op.command() != null) {
            MdcContext.setCommand(op.command());
        }

        Authorization authorization = authorizer.authorize(op.command(), args);
        if (!authorization.isApproved()) {
            return new CommandReport(op.command(), args, authorization.rejection(), null);
        }

        Approval approval = authorization.approval();
        int maxTimeout = Math.min(approval.policy().maxTimeoutSeconds(), properties.getMaxTimeoutSeconds());
        int timeout = Params.intInRange("timeoutSeconds", op.timeoutSeconds(),
                Math.min(properties.getDefaultTimeoutSeconds(), maxTimeout), 1, maxTimeout);
        int maxOutput = Params.intInRange("maxOutputBytes", op.maxOutputBytes(),
                properties.getMaxOutputBytes(), 1, properties.getMaxOutputBytes());

        ExecutionResult result = executor.execute(ExecutionRequest.of(approval, timeout, maxOutput));
        return new CommandReport(op.command(), approval.args(), null, result);
    }
}
