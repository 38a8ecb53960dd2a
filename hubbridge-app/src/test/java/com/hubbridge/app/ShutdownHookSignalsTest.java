package com.hubbridge.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownHookSignalsTest {

    @Test
    void attachAndDetach_leaveNoHookBehind() {
        ShutdownHookSignals signals = new ShutdownHookSignals(Duration.ofSeconds(1));
        List<String> received = new ArrayList<>();

        signals.attach(received::add);
        signals.attach(received::add);
        signals.detach();
        signals.detach();
        signals.released();

        assertTrue(received.isEmpty());
        assertFalse(signals.isFired());
    }
}
