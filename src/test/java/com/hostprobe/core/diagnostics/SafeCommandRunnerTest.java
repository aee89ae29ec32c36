package com.hostprobe.core.diagnostics;

import com.hostprobe.core.exec.BoundedExecutor;
import com.hostprobe.core.exec.ExecutionOutcome;
import com.hostprobe.core.exec.ExecutionProperties;
import com.hostprobe.core.exec.ExecutionRequest;
import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.metrics.ProbeMetrics;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.policy.CommandPolicy;
import com.hostprobe.core.policy.PathPolicy;
import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.security.CommandAuthorizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SafeCommandRunnerTest {

    private BoundedExecutor executor;
    private ExecutionProperties properties;
    private SafeCommandRunner runner;

    @BeforeEach
    void setUp() {
        var store = new PolicyStore(
                Map.of("df", new CommandPolicy("df", List.of(), 60),
                        "ping", new CommandPolicy("ping", List.of(), 10)),
                new PathPolicy(List.of()), List.of(), Set.of(';'), 20, 1024);
        executor = mock(BoundedExecutor.class);
        when(executor.execute(any())).thenReturn(
                new ExecutionResult(0, null, "ok", "", false, false, 5, ExecutionOutcome.COMPLETED, null));
        properties = new ExecutionProperties();
        runner = new SafeCommandRunner(
                new CommandAuthorizer(store, new ProbeMetrics(new SimpleMeterRegistry())), executor, properties);
    }

    private ExecutionRequest captured() {
        var captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executor).execute(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("a rejected command never reaches the executor")
    void rejectedNeverSpawns() {
        CommandReport report = runner.run(new DiagnosticOperation.RunCommand("rm", List.of("-rf", "/"), null));

        assertFalse(report.approved());
        assertEquals(ErrorKind.UNAUTHORIZED_COMMAND, report.errorKind());
        assertNull(report.result());
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("forbidden characters never reach the executor")
    void forbiddenNeverSpawns() {
        CommandReport report = runner.run(new DiagnosticOperation.RunCommand("df", List.of("/;reboot"), null));

        assertEquals(ErrorKind.MALFORMED_ARGUMENT, report.errorKind());
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("an approved command runs with the default limits")
    void defaults() {
        CommandReport report = runner.run(new DiagnosticOperation.RunCommand("df", List.of("-h"), null));

        assertTrue(report.approved());
        assertNull(report.errorKind());
        assertEquals("ok", report.result().stdout());
        ExecutionRequest request = captured();
        assertEquals("df", request.command());
        assertEquals(List.of("-h"), request.arguments());
        assertEquals(30, request.timeoutSeconds());
        assertEquals(properties.getMaxOutputBytes(), request.maxOutputBytes());
    }

    @Test
    @DisplayName("the default timeout is clamped to the command's maximum")
    void defaultClampedToCommandMax() {
        runner.run(new DiagnosticOperation.RunCommand("ping", List.of("localhost"), null));
        assertEquals(10, captured().timeoutSeconds());
    }

    @Test
    @DisplayName("a timeout above the command's maximum is an invalid request")
    void timeoutTooLarge() {
        var op = new DiagnosticOperation.RunCommand("ping", List.of("localhost"), 11);
        assertThrows(InvalidRequestException.class, () -> runner.run(op));
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("a smaller output cap is passed through")
    void outputCap() {
        runner.run(new DiagnosticOperation.RunCommand("df", List.of(), 5, 25_000));
        ExecutionRequest request = captured();
        assertEquals(5, request.timeoutSeconds());
        assertEquals(25_000, request.maxOutputBytes());
    }

    @Test
    @DisplayName("null arguments are treated as none")
    void nullArguments() {
        CommandReport report = runner.run(new DiagnosticOperation.RunCommand("df", null, null));
        assertTrue(report.approved());
        assertEquals(List.of(), captured().arguments());
    }
}
