package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.ConnectivityReport;
import com.hostprobe.core.model.EnvironmentReport;
import com.hostprobe.core.model.LogExcerpt;
import com.hostprobe.core.model.LogFileInfo;
import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.security.PathCheck;

import java.util.List;

/**
 * A diagnostic request as plain data. Each variant is routed by {@link DiagnosticDispatcher}
 * to the handler registered for its type.
 *
 * @param <R> result type
 */
public interface DiagnosticOperation<R> {

    /**
     * Name used in logs and the MDC.
     */
    String operationName();

    /**
     * @param timeoutSeconds defaults to the configured default timeout when {@code null}
     * @param maxOutputBytes defaults to the configured cap when {@code null}
     */
    record RunCommand(String command, List<String> arguments, Integer timeoutSeconds, Integer maxOutputBytes)
            implements DiagnosticOperation<CommandReport> {
        public RunCommand {
            arguments = arguments == null ? List.of() : arguments;
        }

        public RunCommand(String command, List<String> arguments, Integer timeoutSeconds) {
            this(command, arguments, timeoutSeconds, null);
        }

        @Override
        public String operationName() { return "run-command"; }
    }

    record ReadLog(String path, Integer lines, String filter) implements DiagnosticOperation<LogExcerpt> {
        @Override
        public String operationName() { return "read-log"; }
    }

    record ListLogs() implements DiagnosticOperation<List<LogFileInfo>> {
        @Override
        public String operationName() { return "list-logs"; }
    }

    record InspectEnvironment(String filter) implements DiagnosticOperation<EnvironmentReport> {
        @Override
        public String operationName() { return "inspect-environment"; }
    }

    record SearchProcesses(String filter, Integer limit) implements DiagnosticOperation<ProcessReport> {
        @Override
        public String operationName() { return "search-processes"; }
    }

    record TestConnectivity(String host, Integer port, Integer timeoutSeconds)
            implements DiagnosticOperation<ConnectivityReport> {
        @Override
        public String operationName() { return "test-connectivity"; }
    }

    record DescribePolicy() implements DiagnosticOperation<PolicySummary> {
        @Override
        public String operationName() { return "describe-policy"; }
    }

    record CheckPath(String path) implements DiagnosticOperation<PathCheck> {
        @Override
        public String operationName() { return "check-path"; }
    }
}
