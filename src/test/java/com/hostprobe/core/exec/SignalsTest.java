package com.hostprobe.core.exec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalsTest {

    @Test
    @DisplayName("128 + n maps to the signal name")
    void mapsSignals() {
        assertEquals("SIGKILL", Signals.fromExitStatus(137));
        assertEquals("SIGTERM", Signals.fromExitStatus(143));
        assertEquals("SIGSEGV", Signals.fromExitStatus(139));
        assertEquals("SIGHUP", Signals.fromExitStatus(129));
    }

    @Test
    @DisplayName("ordinary exit statuses have no signal")
    void ordinaryStatus() {
        assertNull(Signals.fromExitStatus(0));
        assertNull(Signals.fromExitStatus(1));
        assertNull(Signals.fromExitStatus(128));
        assertNull(Signals.fromExitStatus(200));
    }
}
