package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.ConnectivityReport;
import com.hostprobe.core.model.PortStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeUnit;

/**
 * DNS resolution plus an optional TCP connect test. A DNS failure ends the probe before any
 * connection is attempted.
 */
@Service
public class NetworkProbe {

    private static final Logger log = LoggerFactory.getLogger(NetworkProbe.class);

    static final int MAX_HOST_LENGTH = 253;

    private final HostResolver resolver;

    @Autowired
    public NetworkProbe() {
        this(HostResolver.system());
    }

    NetworkProbe(HostResolver resolver) {
        this.resolver = resolver;
    }

    public ConnectivityReport probe(DiagnosticOperation.TestConnectivity op) {
        String host = validateHost(op.host());
        Integer port = op.port() == null ? null : Params.intInRange("port", op.port(), 0, 1, 65535);
        int timeoutSeconds = Params.intInRange("timeoutSeconds", op.timeoutSeconds(), 5, 1, 30);

        long dnsStart = System.nanoTime();
        InetAddress address;
        try {
            address = resolver.resolve(host);
        } catch (UnknownHostException e) {
            long dnsMillis = elapsedMillis(dnsStart);
            log.info("Cannot resolve hostname '{}'", host);
            return new ConnectivityReport(host, null, dnsMillis, port, PortStatus.NOT_TESTED, null,
                    "Cannot resolve hostname '" + host + "'");
        }
        long dnsMillis = elapsedMillis(dnsStart);
        String resolved = address.getHostAddress();

        if (port == null) {
            return new ConnectivityReport(host, resolved, dnsMillis, null, PortStatus.NOT_TESTED, null, null);
        }

        long connectStart = System.nanoTime();
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), (int) TimeUnit.SECONDS.toMillis(timeoutSeconds));
            return new ConnectivityReport(host, resolved, dnsMillis, port, PortStatus.OPEN,
                    elapsedMillis(connectStart), null);
        } catch (SocketTimeoutException e) {
            return new ConnectivityReport(host, resolved, dnsMillis, port, PortStatus.TIMEOUT, null,
                    "Connection timed out after " + timeoutSeconds + "s");
        } catch (ConnectException e) {
            return new ConnectivityReport(host, resolved, dnsMillis, port, PortStatus.CLOSED, null,
                    "Connection refused");
        } catch (IOException e) {
            log.debug("Connect to {}:{} failed", resolved, port, e);
            return new ConnectivityReport(host, resolved, dnsMillis, port, PortStatus.FAILED, null,
                    String.valueOf(e.getMessage()));
        }
    }

    private static String validateHost(String host) {
        if (host == null || host.isBlank()) {
            throw new InvalidRequestException("host is required");
        }
        String trimmed = host.trim();
        if (trimmed.length() > MAX_HOST_LENGTH) {
            throw new InvalidRequestException("host must be at most " + MAX_HOST_LENGTH + " characters");
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidRequestException("host must not contain whitespace or control characters");
            }
        }
        return trimmed;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
