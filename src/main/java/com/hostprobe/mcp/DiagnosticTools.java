package com.hostprobe.mcp;

import com.hostprobe.core.diagnostics.CommandReport;
import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.diagnostics.InvalidRequestException;
import com.hostprobe.core.exec.ExecutionProperties;
import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.model.ConnectivityReport;
import com.hostprobe.core.model.EnvironmentReport;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.model.LogExcerpt;
import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.security.Rejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * MCP tools exposed to agents. Every tool goes through the {@link DiagnosticDispatcher}, so an
 * agent gets exactly the checks the CLI and REST surfaces get. Command output is capped lower
 * than on the other surfaces to keep tool results small.
 */
@Component
public class DiagnosticTools {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticTools.class);

    private final DiagnosticDispatcher dispatcher;
    private final ExecutionProperties executionProperties;

    public DiagnosticTools(DiagnosticDispatcher dispatcher, ExecutionProperties executionProperties) {
        this.dispatcher = dispatcher;
        this.executionProperties = executionProperties;
    }

    @Tool(name = "troubleshooting_execute_safe_command",
          description = "Run a whitelisted read-only diagnostic command (e.g. ss, df, ip, dig) with a timeout. "
                  + "Dangerous arguments are rejected before anything is spawned.")
    public Object executeSafeCommand(
            @ToolParam(description = "Command name, without a path, e.g. 'df'") String command,
            @ToolParam(required = false, description = "Arguments, one token per element") List<String> arguments,
            @ToolParam(required = false, description = "Timeout in seconds") Integer timeoutSeconds) {
        return guarded(() -> {
            CommandReport report = dispatcher.dispatch(new DiagnosticOperation.RunCommand(
                    command, arguments, timeoutSeconds, executionProperties.getMcpMaxOutputBytes()));
            return describe(report);
        });
    }

    @Tool(name = "troubleshooting_read_log_file",
          description = "Read the last lines of a log file inside the allowed directories, optionally "
                  + "keeping only lines containing a case-insensitive filter.")
    public Object readLogFile(
            @ToolParam(description = "Absolute path of the log file") String path,
            @ToolParam(required = false, description = "Number of trailing lines, default 50") Integer lines,
            @ToolParam(required = false, description = "Case-insensitive substring filter") String filter) {
        return guarded(() -> {
            LogExcerpt excerpt = dispatcher.dispatch(new DiagnosticOperation.ReadLog(path, lines, filter));
            return excerpt;
        });
    }

    @Tool(name = "troubleshooting_inspect_environment",
          description = "List environment variables of the server process with secret values masked.")
    public Object inspectEnvironment(
            @ToolParam(required = false, description = "Case-insensitive substring of the variable name") String filter) {
        return guarded(() -> {
            EnvironmentReport report = dispatcher.dispatch(new DiagnosticOperation.InspectEnvironment(filter));
            return report;
        });
    }

    @Tool(name = "troubleshooting_search_processes",
          description = "List running processes sorted by CPU time, optionally filtered by command line.")
    public Object searchProcesses(
            @ToolParam(required = false, description = "Case-insensitive substring of the command line") String filter,
            @ToolParam(required = false, description = "Maximum number of processes, 1-100, default 20") Integer limit) {
        return guarded(() -> {
            ProcessReport report = dispatcher.dispatch(new DiagnosticOperation.SearchProcesses(filter, limit));
            return report;
        });
    }

    @Tool(name = "troubleshooting_test_network_connectivity",
          description = "Resolve a host name and optionally test a TCP connection to a port.")
    public Object testNetworkConnectivity(
            @ToolParam(description = "Host name or IP address") String host,
            @ToolParam(required = false, description = "TCP port, 1-65535") Integer port,
            @ToolParam(required = false, description = "Connect timeout in seconds, 1-30, default 5") Integer timeoutSeconds) {
        return guarded(() -> {
            ConnectivityReport report = dispatcher.dispatch(
                    new DiagnosticOperation.TestConnectivity(host, port, timeoutSeconds));
            return report;
        });
    }

    /**
     * Invalid parameters come back as a tool result the agent can read, not as a protocol error.
     */
    private static Object guarded(Supplier<Object> call) {
        try {
            return call.get();
        } catch (InvalidRequestException e) {
            log.debug("Tool call rejected: {}", e.getMessage());
            return Map.of("kind", ErrorKind.INVALID_REQUEST.name(), "error", e.getMessage());
        }
    }

    static Map<String, Object> describe(CommandReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", report.command());
        body.put("arguments", report.arguments());
        body.put("approved", report.approved());
        Rejection rejection = report.rejection();
        if (rejection != null) {
            body.put("kind", rejection.kind().name());
            body.put("error", rejection.detail());
            return body;
        }
        ExecutionResult result = report.result();
        body.put("outcome", result.outcome().name());
        body.put("exitCode", result.exitCode());
        body.put("signal", result.signal());
        body.put("durationMillis", result.durationMillis());
        body.put("stdout", result.stdout());
        body.put("stderr", result.stderr());
        body.put("stdoutTruncated", result.stdoutTruncated());
        body.put("stderrTruncated", result.stderrTruncated());
        ErrorKind kind = result.errorKind();
        if (kind != null) {
            body.put("kind", kind.name());
        }
        if (result.error() != null) {
            body.put("error", result.error());
        }
        return body;
    }
}
