package com.hostprobe.core.exec;

import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.policy.CommandPolicy;
import com.hostprobe.core.policy.PathPolicy;
import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.policy.SecretPattern;
import com.hostprobe.core.security.Approval;
import com.hostprobe.core.security.CommandAuthorizer;
import com.hostprobe.core.security.SecretMasker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class BoundedExecutorTest {

    private static final String SEARCH_PATH = "/bin:/usr/bin";

    private ExecutionProperties properties;
    private CommandAuthorizer authorizer;
    private SecretMasker masker;
    private SimpleMeterRegistry registry;
    private ProbeMetrics metrics;
    private BoundedExecutor executor;

    @BeforeEach
    void setUp() {
        Map<String, CommandPolicy> commands = new LinkedHashMap<>();
        for (String name : List.of("echo", "sh", "sleep", "seq", "nosuchcmd-hostprobe")) {
            commands.put(name, new CommandPolicy(name, List.of(), 60));
        }
        var store = new PolicyStore(commands, new PathPolicy(List.of()),
                List.of(SecretPattern.glob("*PASSWORD*")), Set.of(), 20, 1024);
        registry = new SimpleMeterRegistry();
        metrics = new ProbeMetrics(registry);
        authorizer = new CommandAuthorizer(store, metrics);
        masker = new SecretMasker(store);

        properties = new ExecutionProperties();
        properties.setKillGraceMillis(300);
        properties.setDrainJoinMillis(300);
        executor = new BoundedExecutor(properties, new ExecutableLocator(SEARCH_PATH), masker, metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** A reparented zombie waiting for init to reap it has already terminated. */
    private static boolean isRunning(ProcessHandle handle) throws IOException {
        if (!handle.isAlive()) {
            return false;
        }
        Path stat = Path.of("/proc", String.valueOf(handle.pid()), "stat");
        if (!Files.exists(stat)) {
            return handle.isAlive();
        }
        String line = Files.readString(stat);
        return line.charAt(line.lastIndexOf(')') + 2) != 'Z';
    }

    private Approval approve(String command, String... args) {
        return authorizer.authorize(command, List.of(args)).approval();
    }

    private ExecutionResult run(int timeoutSeconds, int maxOutputBytes, String command, String... args) {
        return executor.execute(ExecutionRequest.of(approve(command, args), timeoutSeconds, maxOutputBytes));
    }

    @Nested
    @DisplayName("Completed runs")
    class Completed {

        @Test
        @DisplayName("captures stdout and the exit code")
        void capturesStdout() {
            ExecutionResult result = run(10, 1024, "echo", "hello");

            assertEquals(ExecutionOutcome.COMPLETED, result.outcome());
            assertEquals(0, result.exitCode());
            assertEquals("hello\n", result.stdout());
            assertEquals("", result.stderr());
            assertNull(result.signal());
            assertNull(result.errorKind());
        }

        @Test
        @DisplayName("a non-zero exit is still a completed run")
        void nonZeroExit() {
            ExecutionResult result = run(10, 1024, "sh", "-c", "echo oops >&2; exit 3");

            assertEquals(ExecutionOutcome.COMPLETED, result.outcome());
            assertEquals(3, result.exitCode());
            assertEquals("oops\n", result.stderr());
        }

        @Test
        @DisplayName("arguments are passed verbatim, never through a shell")
        void noShellExpansion() {
            ExecutionResult result = run(10, 1024, "echo", "$HOME", "*", "a b");

            assertEquals("$HOME * a b\n", result.stdout());
        }

        @Test
        @DisplayName("output beyond the cap is discarded and flagged")
        void truncation() {
            ExecutionResult result = run(10, 100, "seq", "1", "5000");

            assertEquals(ExecutionOutcome.COMPLETED, result.outcome());
            assertEquals(0, result.exitCode(), "the child must not block on a full pipe");
            assertTrue(result.stdoutTruncated());
            assertFalse(result.stderrTruncated());
            assertEquals(100, result.stdout().length());
            assertTrue(result.stdout().startsWith("1\n2\n3\n"));
            assertEquals(1.0, registry.find("hostprobe.execution.truncations").tag("stream", "stdout").counter().count());
        }

        @Test
        @DisplayName("a background grandchild holding the pipe does not hang the call")
        void grandchildHoldsPipe() {
            long start = System.nanoTime();
            ExecutionResult result = run(10, 1024, "sh", "-c", "sleep 3 & echo started");
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertEquals(ExecutionOutcome.COMPLETED, result.outcome());
            assertEquals("started\n", result.stdout());
            assertTrue(elapsedMillis < 2500, "returned after " + elapsedMillis + " ms");
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("'sleep 10' with a 1s timeout is terminated")
        void terminatesOnDeadline() {
            var launched = new AtomicReference<Process>();
            var tracking = new BoundedExecutor(properties, new ExecutableLocator(SEARCH_PATH), masker, metrics,
                    commandLine -> {
                        Process p = ProcessLauncher.system().launch(commandLine);
                        launched.set(p);
                        return p;
                    });
            try {
                long start = System.nanoTime();
                ExecutionResult result = tracking.execute(ExecutionRequest.of(approve("sleep", "10"), 1, 1024));
                long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

                assertEquals(ExecutionOutcome.TIMED_OUT, result.outcome());
                assertNull(result.exitCode());
                assertEquals("SIGTERM", result.signal());
                assertEquals(com.hostprobe.core.model.ErrorKind.TIMEOUT_EXCEEDED, result.errorKind());
                assertTrue(elapsedMillis < 4000, "returned after " + elapsedMillis + " ms");
                assertFalse(launched.get().isAlive(), "the child must be reaped before returning");
            } finally {
                tracking.shutdown();
            }
        }

        @Test
        @DisplayName("grandchildren are terminated along with the child")
        void terminatesWholeTree() throws Exception {
            var snapshot = new AtomicReference<CompletableFuture<List<ProcessHandle>>>();
            var tracking = new BoundedExecutor(properties, new ExecutableLocator(SEARCH_PATH), masker, metrics,
                    commandLine -> {
                        Process p = ProcessLauncher.system().launch(commandLine);
                        snapshot.set(CompletableFuture.supplyAsync(() -> {
                            sleepQuietly(400);
                            return p.descendants().toList();
                        }));
                        return p;
                    });
            try {
                ExecutionResult result = tracking.execute(ExecutionRequest.of(
                        approve("sh", "-c", "sleep 30 & echo $!; sleep 30"), 1, 1024));
                List<ProcessHandle> descendants = snapshot.get().get(5, TimeUnit.SECONDS);

                assertEquals(ExecutionOutcome.TIMED_OUT, result.outcome());
                long background = Long.parseLong(result.stdout().trim());
                assertTrue(descendants.stream().anyMatch(h -> h.pid() == background),
                        "the background sleep was running at the deadline: " + descendants);
                for (ProcessHandle handle : descendants) {
                    assertFalse(isRunning(handle), "pid " + handle.pid() + " survived the timeout");
                }
            } finally {
                tracking.shutdown();
            }
        }

        @Test
        @DisplayName("a child ignoring SIGTERM is killed")
        void escalatesToKill() {
            ExecutionResult result = run(1, 1024, "sh", "-c", "trap '' TERM; echo ready; while true; do sleep 0.1; done");

            assertEquals(ExecutionOutcome.TIMED_OUT, result.outcome());
            assertEquals("SIGKILL", result.signal());
            assertEquals("ready\n", result.stdout(), "partial output is kept");
        }

        @Test
        @DisplayName("timeouts are recorded by outcome")
        void timeoutMetric() {
            run(1, 1024, "sleep", "5");
            assertEquals(1, registry.find("hostprobe.execution.duration")
                    .tag("command", "sleep").tag("outcome", "timed_out").timer().count());
        }
    }

    @Nested
    @DisplayName("Spawn failures")
    class SpawnFailures {

        @Test
        @DisplayName("a whitelisted command missing from the search path")
        void commandNotFound() {
            ExecutionResult result = run(5, 1024, "nosuchcmd-hostprobe");

            assertEquals(ExecutionOutcome.SPAWN_FAILED, result.outcome());
            assertNull(result.exitCode());
            assertEquals("command not found: nosuchcmd-hostprobe", result.error());
            assertEquals(com.hostprobe.core.model.ErrorKind.SPAWN_FAILED, result.errorKind());
        }

        @Test
        @DisplayName("a launcher error is reported, not thrown")
        void launcherError() {
            var failing = new BoundedExecutor(properties, new ExecutableLocator(SEARCH_PATH), masker, metrics,
                    commandLine -> {
                        throw new IOException("error=13, Permission denied");
                    });
            ExecutionResult result = failing.execute(ExecutionRequest.of(approve("echo", "x"), 5, 1024));

            assertEquals(ExecutionOutcome.SPAWN_FAILED, result.outcome());
            assertEquals("error=13, Permission denied", result.error());
            failing.shutdown();
        }

        @Test
        @DisplayName("the resolved absolute path is launched")
        void launchesResolvedPath() {
            var seen = new ArrayList<List<String>>();
            var capturing = new BoundedExecutor(properties, new ExecutableLocator(SEARCH_PATH), masker, metrics,
                    commandLine -> {
                        seen.add(commandLine);
                        throw new IOException("stop");
                    });
            capturing.execute(ExecutionRequest.of(approve("echo", "a"), 5, 1024));

            assertEquals(1, seen.size());
            assertTrue(seen.get(0).get(0).startsWith("/"));
            assertTrue(seen.get(0).get(0).endsWith("/echo"));
            assertEquals("a", seen.get(0).get(1));
            capturing.shutdown();
        }
    }

    @Nested
    @DisplayName("Request limits")
    class Limits {

        @Test
        @DisplayName("a cap above the global maximum is refused")
        void outputCapAboveGlobalMax() {
            properties.setMaxOutputBytes(1000);
            ExecutionRequest request = ExecutionRequest.of(approve("echo"), 5, 2000);
            assertThrows(IllegalArgumentException.class, () -> executor.execute(request));
        }

        @Test
        @DisplayName("a timeout above the global maximum is refused")
        void timeoutAboveGlobalMax() {
            properties.setMaxTimeoutSeconds(10);
            ExecutionRequest request = ExecutionRequest.of(approve("echo"), 30, 100);
            assertThrows(IllegalArgumentException.class, () -> executor.execute(request));
        }

        @Test
        @DisplayName("a timeout above the command's maximum cannot be requested")
        void timeoutAboveCommandMax() {
            Approval approval = approve("echo");
            assertThrows(IllegalArgumentException.class, () -> ExecutionRequest.of(approval, 61, 100));
            assertThrows(IllegalArgumentException.class, () -> ExecutionRequest.of(approval, 0, 100));
            assertThrows(IllegalArgumentException.class, () -> ExecutionRequest.of(approval, 5, 0));
        }
    }
}
