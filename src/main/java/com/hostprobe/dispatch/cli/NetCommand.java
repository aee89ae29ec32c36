package com.hostprobe.dispatch.cli;

import com.hostprobe.core.diagnostics.DiagnosticDispatcher;
import com.hostprobe.core.diagnostics.DiagnosticOperation;
import com.hostprobe.core.model.ConnectivityReport;
import com.hostprobe.core.model.PortStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: hostprobe net &lt;host&gt; [--port n]
 * <p>
 * Exit code is {@code 1} when DNS resolution fails or the port is not open.
 */
@Command(name = "net", mixinStandardHelpOptions = true, description = "Test DNS resolution and TCP connectivity")
@Component
public class NetCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Hostname or IP address")
    private String host;

    @Option(names = {"-p", "--port"}, description = "TCP port to test (1-65535)")
    private Integer port;

    @Option(names = {"-t", "--timeout"}, description = "Connect timeout in seconds (1-30, default 5)")
    private Integer timeoutSeconds;

    private final DiagnosticDispatcher dispatcher;

    public NetCommand(DiagnosticDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        ConnectivityReport report = dispatcher.dispatch(
                new DiagnosticOperation.TestConnectivity(host, port, timeoutSeconds));

        ConsoleOutput.info("Network connectivity test: " + report.host());
        if (!report.resolved()) {
            ConsoleOutput.error("DNS resolution failed: " + report.error());
            return 1;
        }
        ConsoleOutput.success("DNS resolution: " + report.resolvedAddress() + " (" + report.dnsMillis() + "ms)");

        if (report.port() == null) {
            return ExitCodes.OK;
        }
        if (report.portStatus() == PortStatus.OPEN) {
            ConsoleOutput.success("Port " + report.port() + " is OPEN (" + report.connectMillis() + "ms)");
            return ExitCodes.OK;
        }
        ConsoleOutput.error("Port " + report.port() + " is " + report.portStatus() + ": " + report.error());
        return 1;
    }
}
