package com.hostprobe.core.model;

/**
 * DNS resolution followed by an optional TCP connect.
 *
 * @param resolvedAddress first resolved address, {@code null} when DNS failed
 * @param port            port tested, {@code null} when none was requested
 * @param connectMillis   connect time for an {@link PortStatus#OPEN} port, otherwise {@code null}
 * @param error           DNS or connect failure detail, or {@code null}
 */
public record ConnectivityReport(
    String host,
    String resolvedAddress,
    long dnsMillis,
    Integer port,
    PortStatus portStatus,
    Long connectMillis,
    String error
) {
    public boolean resolved() {
        return resolvedAddress != null;
    }
}
