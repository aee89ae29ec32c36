package com.hostprobe.core.exec;

import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.security.SecretMasker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs approved commands with a deadline and capped output capture.
 * <p>
 * Per call: {@code Pending -> Spawning -> Running -> Completed | TimedOut | SpawnFailed}.
 * stdout and stderr are drained concurrently on a shared daemon pool while the calling thread
 * waits for the deadline. On expiry the child and its descendants get SIGTERM, then SIGKILL
 * after the grace period. No call returns before the child has been reaped and its drains
 * joined or their streams closed.
 */
@Service
public class BoundedExecutor {

    private static final Logger log = LoggerFactory.getLogger(BoundedExecutor.class);

    private final ExecutionProperties properties;
    private final ExecutableLocator locator;
    private final SecretMasker masker;
    private final ProbeMetrics metrics;
    private final ProcessLauncher launcher;

    private final AtomicInteger drainThreadCount = new AtomicInteger();
    private final ExecutorService drainPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hostprobe-drain-" + drainThreadCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public BoundedExecutor(ExecutionProperties properties, ExecutableLocator locator,
                           SecretMasker masker, ProbeMetrics metrics) {
        this(properties, locator, masker, metrics, ProcessLauncher.system());
    }

    BoundedExecutor(ExecutionProperties properties, ExecutableLocator locator,
                    SecretMasker masker, ProbeMetrics metrics, ProcessLauncher launcher) {
        this.properties = properties;
        this.locator = locator;
        this.masker = masker;
        this.metrics = metrics;
        this.launcher = launcher;
    }

    /**
     * @throws IllegalArgumentException when the request exceeds the configured global maxima
     */
    public ExecutionResult execute(ExecutionRequest request) {
        if (request.timeoutSeconds() > properties.getMaxTimeoutSeconds()) {
            throw new IllegalArgumentException("timeoutSeconds " + request.timeoutSeconds()
                    + " exceeds the global maximum of " + properties.getMaxTimeoutSeconds());
        }
        if (request.maxOutputBytes() > properties.getMaxOutputBytes()) {
            throw new IllegalArgumentException("maxOutputBytes " + request.maxOutputBytes()
                    + " exceeds the global maximum of " + properties.getMaxOutputBytes());
        }

        String display = masker.maskFragment(request.command() + " " + String.join(" ", request.arguments()));
        long start = System.nanoTime();

        Optional<Path> executable = locator.locate(request.command());
        if (executable.isEmpty()) {
            return spawnFailed(request, display, "command not found: " + request.command(), start);
        }

        var commandLine = new ArrayList<String>();
        commandLine.add(executable.get().toString());
        commandLine.addAll(request.arguments());

        Process process;
        try {
            process = launcher.launch(commandLine);
        } catch (IOException | SecurityException e) {
            log.debug("Spawn of {} failed", display, e);
            return spawnFailed(request, display, e.getMessage() == null ? e.toString() : e.getMessage(), start);
        }
        log.info("Started pid {}: {} (timeout {}s)", process.pid(), display, request.timeoutSeconds());

        closeQuietly(process.getOutputStream());
        var stdout = new OutputCapture(request.maxOutputBytes());
        var stderr = new OutputCapture(request.maxOutputBytes());
        Future<?> stdoutDrain = drainPool.submit(() -> stdout.drainFrom(process.getInputStream()));
        Future<?> stderrDrain = drainPool.submit(() -> stderr.drainFrom(process.getErrorStream()));

        String timeoutSignal = null;
        boolean interrupted = false;
        try {
            if (!process.waitFor(request.timeoutSeconds(), TimeUnit.SECONDS)) {
                timeoutSignal = terminate(process);
            }
        } catch (InterruptedException e) {
            interrupted = true;
            timeoutSignal = terminate(process);
        }

        joinDrain(stdoutDrain, process.getInputStream());
        joinDrain(stderrDrain, process.getErrorStream());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        long durationMillis = elapsedMillis(start);
        ExecutionResult result;
        if (timeoutSignal != null) {
            log.warn("Timed out after {}s, ended with {}: {}", request.timeoutSeconds(), timeoutSignal, display);
            result = new ExecutionResult(null, timeoutSignal, stdout.text(), stderr.text(),
                    stdout.truncated(), stderr.truncated(), durationMillis, ExecutionOutcome.TIMED_OUT,
                    interrupted ? "interrupted before the deadline" : null);
        } else {
            int exitCode = process.exitValue();
            log.info("Exited with {} in {} ms: {}", exitCode, durationMillis, display);
            result = new ExecutionResult(exitCode, Signals.fromExitStatus(exitCode), stdout.text(), stderr.text(),
                    stdout.truncated(), stderr.truncated(), durationMillis, ExecutionOutcome.COMPLETED, null);
        }

        metrics.recordExecution(request.command(), outcomeTag(result.outcome()), durationMillis);
        if (result.stdoutTruncated()) {
            metrics.recordTruncation("stdout");
        }
        if (result.stderrTruncated()) {
            metrics.recordTruncation("stderr");
        }
        return result;
    }

    /**
     * Sends SIGTERM to the child and every descendant, then SIGKILL to whatever survives the
     * grace period. Returns the signal that ended the child.
     */
    String terminate(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();

        String signal = "SIGTERM";
        if (!awaitExit(process, properties.getKillGraceMillis())) {
            log.warn("pid {} ignored SIGTERM, sending SIGKILL", process.pid());
            process.destroyForcibly();
            signal = "SIGKILL";
        }
        for (ProcessHandle handle : descendants) {
            if (handle.isAlive()) {
                handle.destroyForcibly();
            }
        }
        for (ProcessHandle handle : descendants) {
            awaitExit(handle, properties.getKillGraceMillis());
        }
        while (process.isAlive()) {
            process.destroyForcibly();
            awaitExit(process, properties.getKillGraceMillis());
        }
        return signal;
    }

    private static boolean awaitExit(Process process, long millis) {
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                try {
                    return process.waitFor(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void awaitExit(ProcessHandle handle, long millis) {
        try {
            handle.onExit().get(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("pid {} still alive after SIGKILL", handle.pid());
        }
    }

    /**
     * Waits for a drain to reach end of stream. A grandchild that inherited the pipe can keep it
     * open after the child exits; in that case the stream is closed to unblock the drain.
     */
    private void joinDrain(Future<?> drain, Closeable stream) {
        try {
            drain.get(properties.getDrainJoinMillis(), TimeUnit.MILLISECONDS);
            return;
        } catch (TimeoutException e) {
            log.debug("Drain still running after {} ms, closing its stream", properties.getDrainJoinMillis());
        } catch (ExecutionException e) {
            log.warn("Output drain failed: {}", e.getCause().toString());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(stream);
        try {
            drain.get(properties.getDrainJoinMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.warn("Output drain did not stop after its stream was closed; cancelling");
            drain.cancel(true);
        } catch (InterruptedException e) {
            drain.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult spawnFailed(ExecutionRequest request, String display, String error, long start) {
        long durationMillis = elapsedMillis(start);
        log.warn("Spawn failed for {}: {}", display, error);
        metrics.recordExecution(request.command(), outcomeTag(ExecutionOutcome.SPAWN_FAILED), durationMillis);
        return ExecutionResult.spawnFailed(error, durationMillis);
    }

    private static String outcomeTag(ExecutionOutcome outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure: {}", e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        drainPool.shutdown();
        try {
            if (!drainPool.awaitTermination(5, TimeUnit.SECONDS)) {
                drainPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            drainPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Output drain pool stopped");
    }
}
