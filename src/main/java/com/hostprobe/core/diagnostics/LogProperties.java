package com.hostprobe.core.diagnostics;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "hostprobe.logs")
public class LogProperties {

    private List<String> commonPaths = new ArrayList<>(List.of(
            "/var/log/syslog",
            "/var/log/messages",
            "/var/log/kern.log",
            "/var/log/auth.log",
            "/var/log/apache2/error.log",
            "/var/log/nginx/error.log",
            "/var/log/mysql/error.log"
    ));
    private int defaultLines = 50;
    private int maxLines = 1000;
    private int maxFilterLength = 200;
    private int chunkSize = 8192;

    public List<String> getCommonPaths() { return commonPaths; }
    public void setCommonPaths(List<String> commonPaths) { this.commonPaths = commonPaths; }
    public int getDefaultLines() { return defaultLines; }
    public void setDefaultLines(int defaultLines) { this.defaultLines = defaultLines; }
    public int getMaxLines() { return maxLines; }
    public void setMaxLines(int maxLines) { this.maxLines = maxLines; }
    public int getMaxFilterLength() { return maxFilterLength; }
    public void setMaxFilterLength(int maxFilterLength) { this.maxFilterLength = maxFilterLength; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
}
