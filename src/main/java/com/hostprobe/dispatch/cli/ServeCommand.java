package com.hostprobe.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hostprobe serve
 * <p>
 * Starts hostprobe as a long-running HTTP server exposing the REST API and the MCP tools.
 * The web server is enabled by {@link com.hostprobe.HostprobeApplication#main} detecting
 * "serve" in args, and {@link CliRunner} skips picocli in that mode.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 hostprobe serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the hostprobe HTTP and MCP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not reached in serve mode; kept for subcommand registration and --help
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("hostprobe server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  MCP (SSE):  http://localhost:" + port + "/sse");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
