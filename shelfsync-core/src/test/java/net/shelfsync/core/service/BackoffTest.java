package net.shelfsync.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void zeroRetries_withoutJitter_equalsFactor() {
        assertEquals(3.0, Backoff.seconds(0, 3, 3, 0, null));
        assertEquals(7.5, Backoff.seconds(0, 7.5, 2, 0, null));
    }

    @Test
    void withoutJitter_isNonDecreasingInRetries() {
        double prev = -1;
        for (int retries = 0; retries < 12; retries++) {
            double d = Backoff.seconds(retries, 3, 3, 0, null);
            assertTrue(d >= prev, "retries=" + retries);
            prev = d;
        }
        assertEquals(3 * 27.0, Backoff.seconds(3, 3, 3, 0, null));
    }

    @Test
    void maxTime_isNeverExceeded() {
        for (int retries = 0; retries < 20; retries++) {
            assertTrue(Backoff.seconds(retries, 3, 3, 0.3, 60.0) <= 60.0);
        }
        assertEquals(60.0, Backoff.seconds(10, 3, 3, 0, 60.0));
    }

    @Test
    void jitter_staysWithinBand() {
        assertEquals(3 * 0.7, Backoff.seconds(0, 3, 3, 0.3, null, () -> 0.0), 1e-9);
        assertEquals(3 * 1.0, Backoff.seconds(0, 3, 3, 0.3, null, () -> 0.5), 1e-9);
        for (int i = 0; i < 200; i++) {
            double d = Backoff.seconds(2);
            assertTrue(d >= 27 * 0.7 - 1e-9 && d <= 27 * 1.3 + 1e-9, "out of band: " + d);
        }
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(-1, 3, 3, 0.3, null));
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(0, 3, 3, 1.5, null));
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(0, 3, 3, -0.1, null));
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(0, -1, 3, 0.3, null));
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(0, 3, 1, 0.3, null));
        assertThrows(IllegalArgumentException.class, () -> Backoff.seconds(0, 3, 3, 0.3, -5.0));
    }

    @Test
    void duration_convertsSeconds() {
        assertEquals(Duration.ofMillis(1500), Backoff.toDuration(1.5));
        assertEquals(Duration.ofSeconds(3), Backoff.duration(0, 3, 3, 0, null));
    }
}
