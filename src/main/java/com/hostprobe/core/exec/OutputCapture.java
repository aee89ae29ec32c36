package com.hostprobe.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Byte-capped sink for one child output stream.
 * <p>
 * Keeps reading after the cap is reached and discards the excess, so the child never blocks
 * on a full pipe. Appends and snapshots are synchronized because the executor may read the
 * buffer while a drain thread is still running.
 */
final class OutputCapture {

    private static final Logger log = LoggerFactory.getLogger(OutputCapture.class);

    private final int limit;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean truncated;

    OutputCapture(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    /**
     * Reads {@code in} until end of stream or until the stream is closed underneath us.
     */
    void drainFrom(InputStream in) {
        byte[] chunk = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                append(chunk, n);
            }
        } catch (IOException e) {
            // the executor closes the stream when a drain outlives the child
            log.debug("Output stream closed while draining: {}", e.getMessage());
        }
    }

    synchronized void append(byte[] data, int length) {
        int room = limit - buffer.size();
        if (length > room) {
            truncated = true;
        }
        if (room > 0) {
            buffer.write(data, 0, Math.min(room, length));
        }
    }

    synchronized int size() {
        return buffer.size();
    }

    synchronized boolean truncated() {
        return truncated;
    }

    /**
     * Captured bytes decoded as UTF-8. A multi-byte character split by the cap is dropped, so
     * truncated text never re-encodes to more than the cap. Malformed bytes written by the
     * child itself still become U+FFFD.
     */
    synchronized String text() {
        byte[] data = buffer.toByteArray();
        int length = truncated ? completeLength(data) : data.length;
        return new String(data, 0, length, StandardCharsets.UTF_8);
    }

    /**
     * Length of {@code data} without a trailing UTF-8 sequence that is missing continuation bytes.
     */
    static int completeLength(byte[] data) {
        int i = data.length - 1;
        while (i >= 0 && data.length - i <= 3 && (data[i] & 0xC0) == 0x80) {
            i--;
        }
        if (i < 0) {
            return data.length;
        }
        int lead = data[i] & 0xFF;
        int expected = lead >= 0xF8 ? 1 : lead >= 0xF0 ? 4 : lead >= 0xE0 ? 3 : lead >= 0xC0 ? 2 : 1;
        return expected > data.length - i ? i : data.length;
    }

    synchronized byte[] bytes() {
        return buffer.toByteArray();
    }
}
