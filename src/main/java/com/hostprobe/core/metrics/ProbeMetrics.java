package com.hostprobe.core.metrics;

import com.hostprobe.core.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for authorization, sandboxing and execution.
 */
@Service
public class ProbeMetrics {

    private final MeterRegistry registry;

    public ProbeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordApproval() {
        Counter.builder("hostprobe.authorization.decisions")
                .description("Command authorization decisions")
                .tag("result", "approved")
                .tag("kind", "none")
                .register(registry)
                .increment();
    }

    public void recordRejection(ErrorKind kind) {
        Counter.builder("hostprobe.authorization.decisions")
                .description("Command authorization decisions")
                .tag("result", "rejected")
                .tag("kind", tagValue(kind))
                .register(registry)
                .increment();
    }

    /**
     * Records the wall-clock duration of one child process.
     *
     * @param command whitelisted command name
     * @param outcome {@code completed}, {@code timed_out} or {@code spawn_failed}
     */
    public void recordExecution(String command, String outcome, long ms) {
        Timer.builder("hostprobe.execution.duration")
                .tag("command", command)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param stream "stdout" or "stderr"
     */
    public void recordTruncation(String stream) {
        Counter.builder("hostprobe.execution.truncations")
                .description("Captured output streams cut at the byte cap")
                .tag("stream", stream)
                .register(registry)
                .increment();
    }

    public void recordPathResolution(ErrorKind errorOrNull) {
        Counter.builder("hostprobe.path.resolutions")
                .tag("result", errorOrNull == null ? "accessible" : tagValue(errorOrNull))
                .register(registry)
                .increment();
    }

    private static String tagValue(ErrorKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
