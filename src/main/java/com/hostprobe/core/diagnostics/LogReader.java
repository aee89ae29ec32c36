package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.DiagnosticError;
import com.hostprobe.core.model.ErrorKind;
import com.hostprobe.core.model.LogExcerpt;
import com.hostprobe.core.model.LogFileInfo;
import com.hostprobe.core.security.PathCheck;
import com.hostprobe.core.security.PathError;
import com.hostprobe.core.security.PathResolution;
import com.hostprobe.core.security.PathSandboxResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Reads the tail of sandboxed log files. Every path goes through the {@link PathSandboxResolver}
 * first; no content is read unless all access checks pass.
 */
@Service
public class LogReader {

    private static final Logger log = LoggerFactory.getLogger(LogReader.class);

    private final PathSandboxResolver resolver;
    private final LogProperties properties;

    public LogReader(PathSandboxResolver resolver, LogProperties properties) {
        this.resolver = resolver;
        this.properties = properties;
    }

    public LogExcerpt read(DiagnosticOperation.ReadLog op) {
        if (op.path() == null || op.path().isBlank()) {
            throw new InvalidRequestException("path is required");
        }
        int lines = Params.intInRange("lines", op.lines(), properties.getDefaultLines(), 1, properties.getMaxLines());
        String filter = Params.optionalText("filter", op.filter(), properties.getMaxFilterLength());

        PathCheck check = resolver.resolve(op.path());
        String canonical = check.isResolved() ? check.resolution().canonicalPath() : null;
        PathError accessError = check.accessError();
        if (accessError != null) {
            return LogExcerpt.failed(op.path(), canonical, lines, filter,
                    new DiagnosticError(accessError.kind(), accessError.detail()));
        }

        List<String> tail;
        try {
            tail = tail(Path.of(canonical), lines);
        } catch (AccessDeniedException e) {
            return LogExcerpt.failed(op.path(), canonical, lines, filter,
                    new DiagnosticError(ErrorKind.PATH_NOT_READABLE, "Permission denied: " + canonical));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", canonical, e.getMessage());
            return LogExcerpt.failed(op.path(), canonical, lines, filter,
                    new DiagnosticError(ErrorKind.PATH_STAT_FAILED, String.valueOf(e.getMessage())));
        }

        if (filter != null) {
            String needle = filter.toLowerCase(Locale.ROOT);
            tail = tail.stream()
                    .filter(line -> line.toLowerCase(Locale.ROOT).contains(needle))
                    .toList();
        }
        log.debug("Read {} line(s) from {}", tail.size(), canonical);
        return new LogExcerpt(op.path(), canonical, lines, filter, tail, null);
    }

    /**
     * Existing, sandboxed entries of the configured common log locations.
     */
    public List<LogFileInfo> listCommon() {
        var found = new ArrayList<LogFileInfo>();
        for (String candidate : properties.getCommonPaths()) {
            PathCheck check = resolver.resolve(candidate);
            if (!check.isResolved()) {
                continue;
            }
            PathResolution resolution = check.resolution();
            if (!resolution.inSandbox()) {
                log.debug("Common log path {} is outside the sandbox, skipping", candidate);
                continue;
            }
            if (!resolution.exists() || !resolution.isRegularFile()) {
                continue;
            }
            Path path = Path.of(resolution.canonicalPath());
            try {
                found.add(new LogFileInfo(resolution.canonicalPath(), Files.size(path),
                        Files.getLastModifiedTime(path).toInstant(), resolution.readable(), true));
            } catch (IOException e) {
                log.debug("Could not stat {}: {}", path, e.getMessage());
                found.add(new LogFileInfo(resolution.canonicalPath(), -1, null, false, true));
            }
        }
        return found;
    }

    /**
     * Last {@code lines} lines of {@code file}, read backwards in chunks so large files are
     * not loaded whole. Undecodable bytes become U+FFFD.
     */
    List<String> tail(Path file, int lines) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long position = channel.size();
            if (position == 0) {
                return List.of();
            }
            Deque<byte[]> chunks = new ArrayDeque<>();
            int newlines = 0;
            while (position > 0 && newlines <= lines) {
                int length = (int) Math.min(properties.getChunkSize(), position);
                position -= length;
                ByteBuffer buffer = ByteBuffer.allocate(length);
                channel.position(position);
                while (buffer.hasRemaining()) {
                    if (channel.read(buffer) < 0) {
                        break;
                    }
                }
                byte[] chunk = buffer.array();
                for (byte b : chunk) {
                    if (b == '\n') {
                        newlines++;
                    }
                }
                chunks.addFirst(chunk);
            }

            var bytes = new ByteArrayOutputStream();
            for (byte[] chunk : chunks) {
                bytes.writeBytes(chunk);
            }
            String text = bytes.toString(StandardCharsets.UTF_8);
            List<String> all = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
            if (!all.isEmpty() && all.get(all.size() - 1).isEmpty()) {
                all.remove(all.size() - 1);
            }
            int from = Math.max(0, all.size() - lines);
            return List.copyOf(all.subList(from, all.size()));
        }
    }
}
