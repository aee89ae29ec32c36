package com.hostprobe.core.exec;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hostprobe.execution")
public class ExecutionProperties {

    private int defaultTimeoutSeconds = 30;
    private int maxTimeoutSeconds = 300;
    private int maxOutputBytes = 1024 * 1024;
    /** Smaller cap for results returned to MCP clients, which feed them into a model context. */
    private int mcpMaxOutputBytes = 25_000;
    private long killGraceMillis = 2000;
    private long drainJoinMillis = 1000;
    /** Directories searched for whitelisted commands. Defaults to the PATH environment variable. */
    private String searchPath;

    public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
    public int getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
    public void setMaxTimeoutSeconds(int maxTimeoutSeconds) { this.maxTimeoutSeconds = maxTimeoutSeconds; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
    public int getMcpMaxOutputBytes() { return mcpMaxOutputBytes; }
    public void setMcpMaxOutputBytes(int mcpMaxOutputBytes) { this.mcpMaxOutputBytes = mcpMaxOutputBytes; }
    public long getKillGraceMillis() { return killGraceMillis; }
    public void setKillGraceMillis(long killGraceMillis) { this.killGraceMillis = killGraceMillis; }
    public long getDrainJoinMillis() { return drainJoinMillis; }
    public void setDrainJoinMillis(long drainJoinMillis) { this.drainJoinMillis = drainJoinMillis; }
    public String getSearchPath() { return searchPath; }
    public void setSearchPath(String searchPath) { this.searchPath = searchPath; }

    public String effectiveSearchPath() {
        if (searchPath != null && !searchPath.isBlank()) {
            return searchPath;
        }
        String path = System.getenv("PATH");
        return path == null ? "" : path;
    }
}
