package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.ProcessReport;
import com.hostprobe.core.model.ProcessSummary;
import com.hostprobe.core.policy.PolicyProperties;
import com.hostprobe.core.policy.PolicyStore;
import com.hostprobe.core.security.SecretMasker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProcessInspectorTest {

    private final SecretMasker masker = new SecretMasker(PolicyStore.from(new PolicyProperties()));

    private static ProcessHandle handle(long pid, String command, String commandLine, long cpuMillis) {
        ProcessHandle handle = mock(ProcessHandle.class);
        ProcessHandle.Info info = mock(ProcessHandle.Info.class);
        when(handle.pid()).thenReturn(pid);
        when(handle.info()).thenReturn(info);
        when(info.command()).thenReturn(Optional.ofNullable(command));
        when(info.commandLine()).thenReturn(Optional.ofNullable(commandLine));
        when(info.user()).thenReturn(Optional.of("app"));
        when(info.startInstant()).thenReturn(Optional.of(Instant.parse("2026-01-01T00:00:00Z")));
        when(info.totalCpuDuration()).thenReturn(Optional.of(Duration.ofMillis(cpuMillis)));
        return handle;
    }

    private ProcessInspector inspector(ProcessHandle... handles) {
        return new ProcessInspector(masker, () -> Stream.of(handles));
    }

    @Test
    @DisplayName("sorted by CPU time, highest first")
    void sortedByCpu() {
        ProcessReport report = inspector(
                handle(10, "/usr/sbin/nginx", "nginx -g daemon", 50),
                handle(11, "/usr/bin/java", "java -jar app.jar", 9000),
                handle(12, "/usr/sbin/sshd", "sshd -D", 50)
        ).search(new DiagnosticOperation.SearchProcesses(null, null));

        assertEquals(List.of(11L, 10L, 12L), report.processes().stream().map(ProcessSummary::pid).toList());
        assertEquals("java", report.processes().get(0).command());
        assertEquals(20, report.limit());
        assertEquals(3, report.matched());
    }

    @Test
    @DisplayName("command lines are masked")
    void masked() {
        ProcessReport report = inspector(
                handle(20, "/usr/bin/mysql", "mysql --password hunter2 -h db", 1)
        ).search(new DiagnosticOperation.SearchProcesses(null, null));

        assertEquals("mysql --password ******** -h db", report.processes().get(0).commandLine());
    }

    @Test
    @DisplayName("the filter cannot match a secret value")
    void filterMatchesMaskedText() {
        ProcessReport report = inspector(
                handle(20, "/usr/bin/mysql", "mysql --password hunter2", 1)
        ).search(new DiagnosticOperation.SearchProcesses("hunter2", null));

        assertEquals(0, report.matched());
    }

    @Test
    @DisplayName("limit applies after matching")
    void limit() {
        ProcessReport report = inspector(
                handle(1, "/bin/a", "a", 3),
                handle(2, "/bin/b", "b", 2),
                handle(3, "/bin/c", "c", 1)
        ).search(new DiagnosticOperation.SearchProcesses(null, 2));

        assertEquals(3, report.matched());
        assertEquals(2, report.processes().size());
    }

    @Test
    @DisplayName("processes hidden by the OS are skipped")
    void hidden() {
        ProcessReport report = inspector(handle(1, null, null, 0))
                .search(new DiagnosticOperation.SearchProcesses(null, null));
        assertEquals(0, report.matched());
    }

    @Test
    @DisplayName("limit must be between 1 and 100")
    void limitRange() {
        ProcessInspector inspector = inspector();
        assertThrows(InvalidRequestException.class,
                () -> inspector.search(new DiagnosticOperation.SearchProcesses(null, 0)));
        assertThrows(InvalidRequestException.class,
                () -> inspector.search(new DiagnosticOperation.SearchProcesses(null, 101)));
    }

    @Test
    @DisplayName("the real process table includes this JVM")
    void realProcesses() {
        var inspector = new ProcessInspector(masker);
        ProcessReport report = inspector.search(new DiagnosticOperation.SearchProcesses(null, 100));
        assertTrue(report.matched() > 0);
    }
}
