package com.hostprobe.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/diagnostics/commands.
 *
 * @param command        whitelisted command name
 * @param arguments      argument tokens, passed to the process as-is (no shell)
 * @param timeoutSeconds nullable, defaults to the configured default timeout
 */
public record CommandRequest(
    String command,
    List<String> arguments,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds
) {}
