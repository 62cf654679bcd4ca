package io.txtlite.storage;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FlushPolicyTest {

    private static final long NOW = 1_000_000L;
    private final FlushPolicy policy = FlushPolicy.defaults();

    @Test
    void flushes_when_idle_and_spaced() {
        // modified 5s ago, flushed 15s ago
        assertTrue(policy.shouldFlush(NOW, NOW - 5_000, NOW - 15_000));
    }

    @Test
    void recent_activity_blocks_flush() {
        // modified 1s ago
        assertFalse(policy.shouldFlush(NOW, NOW - 1_000, NOW - 15_000));
        // exactly at the idle threshold is not "more than" 3s
        assertFalse(policy.shouldFlush(NOW, NOW - 3_000, NOW - 15_000));
    }

    @Test
    void recent_flush_blocks_flush() {
        assertFalse(policy.shouldFlush(NOW, NOW - 60_000, NOW - 9_000));
        assertFalse(policy.shouldFlush(NOW, NOW - 60_000, NOW - 10_000));
    }

    @Test
    void continuous_activity_never_flushes() {
        long lastModified = 0L;
        long lastFlush = -100_000L;
        for (long t = 0; t < 600_000; t += 2_000) {
            lastModified = t;                     // a write every 2s
            long tick = t + 1_999;                // checked just before the next write
            assertFalse(policy.shouldFlush(tick, lastModified, lastFlush), "tick at " + tick);
        }
    }

    @Test
    void rejects_negative_durations() {
        assertThrows(IllegalArgumentException.class,
                () -> new FlushPolicy(Duration.ofSeconds(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new FlushPolicy(Duration.ZERO, Duration.ofMillis(-1)));
    }
}
