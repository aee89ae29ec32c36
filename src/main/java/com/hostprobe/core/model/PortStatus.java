package com.hostprobe.core.model;

public enum PortStatus {
    OPEN,
    CLOSED,
    TIMEOUT,
    FAILED,
    NOT_TESTED
}
