package com.hostprobe.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@link DiagnosticTools} methods with the MCP server. Only active in
 * {@code serve} mode; the CLI disables the MCP server auto-configuration.
 */
@Configuration
public class McpServerConfig {

    @Bean
    public ToolCallbackProvider diagnosticToolCallbacks(DiagnosticTools tools) {
        return MethodToolCallbackProvider.builder().toolObjects(tools).build();
    }
}
