package com.hostprobe.dispatch.api;

import com.hostprobe.core.diagnostics.CommandReport;
import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.diagnostics.InvalidRequestException;
import com.hostprobe.core.diagnostics.PolicySummary;
import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.model.ConnectivityReport;
import com.hostprobe.core.model.EnvironmentReport;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.model.LogExcerpt;
import com.hostprobe.core.model.LogFileInfo;
import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.security.PathCheck;
import com.hostprobe.core.security.Rejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the diagnostic operations.
 * <p>
 * Rejections map to 403, invalid parameters to 400, missing paths to 404 and spawn failures
 * to 502. A timeout is a normal outcome and returns 200 with {@code outcome=TIMED_OUT}.
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
public class DiagnosticsController {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsController.class);

    private final DiagnosticDispatcher dispatcher;

    public DiagnosticsController(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * POST /api/v1/diagnostics/commands : Authorize and run a whitelisted command.
     */
    @PostMapping("/commands")
    public ResponseEntity<Object> runCommand(@RequestBody CommandRequest request) {
        return guarded(() -> {
            CommandReport report = dispatcher.dispatch(new DiagnosticOperation.RunCommand(
                    request.command(), request.arguments(), request.timeoutSeconds()));
            return ResponseEntity.status(statusFor(report.errorKind())).body(toBody(report));
        });
    }

    /**
     * GET /api/v1/diagnostics/logs?path=...&amp;lines=...&amp;filter=... : Tail a sandboxed log file.
     */
    @GetMapping("/logs")
    public ResponseEntity<Object> readLog(@RequestParam String path,
                                          @RequestParam(required = false) Integer lines,
                                          @RequestParam(required = false) String filter) {
        return guarded(() -> {
            LogExcerpt excerpt = dispatcher.dispatch(new DiagnosticOperation.ReadLog(path, lines, filter));
            ErrorKind kind = excerpt.error() == null ? null : excerpt.error().kind();
            return ResponseEntity.status(statusFor(kind)).body(excerpt);
        });
    }

    /**
     * GET /api/v1/diagnostics/logs/common : Existing common log files inside the sandbox.
     */
    @GetMapping("/logs/common")
    public ResponseEntity<Object> listLogs() {
        List<LogFileInfo> logs = dispatcher.dispatch(new DiagnosticOperation.ListLogs());
        return ResponseEntity.ok(logs);
    }

    @GetMapping("/environment")
    public ResponseEntity<Object> environment(@RequestParam(required = false) String filter) {
        return guarded(() -> {
            EnvironmentReport report = dispatcher.dispatch(new DiagnosticOperation.InspectEnvironment(filter));
            return ResponseEntity.ok(report);
        });
    }

    @GetMapping("/processes")
    public ResponseEntity<Object> processes(@RequestParam(required = false) String filter,
                                            @RequestParam(required = false) Integer limit) {
        return guarded(() -> {
            ProcessReport report = dispatcher.dispatch(new DiagnosticOperation.SearchProcesses(filter, limit));
            return ResponseEntity.ok(report);
        });
    }

    @GetMapping("/network")
    public ResponseEntity<Object> network(@RequestParam String host,
                                          @RequestParam(required = false) Integer port,
                                          @RequestParam(required = false) Integer timeout) {
        return guarded(() -> {
            ConnectivityReport report = dispatcher.dispatch(
                    new DiagnosticOperation.TestConnectivity(host, port, timeout));
            return ResponseEntity.ok(report);
        });
    }

    /**
     * GET /api/v1/diagnostics/paths?path=... : Sandbox resolution of a path, without reading it.
     */
    @GetMapping("/paths")
    public ResponseEntity<Object> checkPath(@RequestParam String path) {
        PathCheck check = dispatcher.dispatch(new DiagnosticOperation.CheckPath(path));
        if (!check.isResolved()) {
            return ResponseEntity.status(statusFor(check.error().kind())).body(check.error());
        }
        return ResponseEntity.ok(check.resolution());
    }

    @GetMapping("/policy")
    public ResponseEntity<PolicySummary> policy() {
        return ResponseEntity.ok(dispatcher.dispatch(new DiagnosticOperation.DescribePolicy()));
    }

    private ResponseEntity<Object> guarded(Supplier<ResponseEntity<Object>> call) {
        try {
            return call.get();
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "kind", ErrorKind.INVALID_REQUEST.name(),
                    "error", e.getMessage()));
        }
    }

    static int statusFor(ErrorKind kind) {
        if (kind == null) {
            return 200;
        }
        return switch (kind) {
            case UNAUTHORIZED_COMMAND, ARGUMENT_REJECTED, MALFORMED_ARGUMENT,
                 PATH_OUTSIDE_SANDBOX, PATH_NOT_READABLE, PATH_NOT_REGULAR_FILE -> 403;
            case PATH_NOT_FOUND -> 404;
            case INVALID_PATH, INVALID_REQUEST -> 400;
            case SPAWN_FAILED -> 502;
            case TIMEOUT_EXCEEDED -> 200;
            case PATH_STAT_FAILED -> 500;
        };
    }

    private static Map<String, Object> toBody(CommandReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", report.command());
        body.put("arguments", report.arguments());
        body.put("approved", report.approved());
        Rejection rejection = report.rejection();
        if (rejection != null) {
            body.put("kind", rejection.kind().name());
            body.put("detail", rejection.detail());
            body.put("rule", rejection.rule() == null ? null : rejection.rule().describe());
            log.debug("Command {} rejected: {}", report.command(), rejection.kind());
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
        if (result.errorKind() != null) {
            body.put("kind", result.errorKind().name());
        }
        if (result.error() != null) {
            body.put("error", result.error());
        }
        return body;
    }
}
