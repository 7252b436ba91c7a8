package dev.hack.logs.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimestampsTest {
    @Test
    void formatsWithFixedMillis() {
        assertEquals("2025-12-30T03:30:48.000Z", Timestamps.formatIso(Instant.parse("2025-12-30T03:30:48Z")));
    }

    @Test
    void convertsNanosBothWays() {
        assertEquals("2025-12-30T03:30:48.866Z", Timestamps.nanosToIso("1767065448866123456").orElseThrow());
        assertEquals("1767065448866000000", Timestamps.toNanos(Instant.parse("2025-12-30T03:30:48.866Z")));
    }

    @Test
    void rejectsUnparsableNanos() {
        assertTrue(Timestamps.nanosToIso("abc").isEmpty());
        assertTrue(Timestamps.nanosToIso("").isEmpty());
        assertTrue(Timestamps.nanosToIso("9".repeat(40)).isEmpty());
    }
}
