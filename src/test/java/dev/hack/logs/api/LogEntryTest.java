package dev.hack.logs.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogEntryTest {
    @Test
    void serializesKnownKeysInWireOrderAndSkipsAbsentOnes() {
        var entry = LogEntry.builder(LogBackend.LOKI)
            .message("m")
            .raw("r")
            .service("api")
            .labels(Map.of("service", "api"))
            .timestampNs("1")
            .timestamp("1970-01-01T00:00:00.000Z")
            .level(LogLevel.WARN)
            .fields(Map.of("b", "2", "a", "1"))
            .build();

        var map = entry.toSerializableMap();

        assertEquals(List.of("source", "message", "raw", "service", "labels", "timestamp_ns", "timestamp", "level", "fields"),
            List.copyOf(map.keySet()));
        assertEquals("loki", map.get("source"));
        assertEquals("warn", map.get("level"));
        assertEquals(List.of("a", "b"), List.copyOf(entry.fields().keySet()));
    }

    @Test
    void emptyValuesBecomeAbsent() {
        var entry = LogEntry.builder(LogBackend.COMPOSE)
            .message("")
            .raw("")
            .project("")
            .labels(Map.of())
            .fields(Map.of())
            .build();

        assertNull(entry.project());
        assertNull(entry.labels());
        assertNull(entry.fields());
        assertFalse(entry.levelOpt().isPresent());
    }

    @Test
    void requiresMessageAndRaw() {
        assertThrows(NullPointerException.class, () -> LogEntry.builder(LogBackend.COMPOSE).raw("r").build());
        assertThrows(NullPointerException.class, () -> LogEntry.builder(LogBackend.COMPOSE).message("m").build());
    }

    @Test
    void levelNamesNormalize() {
        assertEquals(LogLevel.DEBUG, LogLevel.fromName(" Debug "));
        assertEquals(LogLevel.WARN, LogLevel.fromName("warning"));
        assertEquals(LogLevel.ERROR, LogLevel.fromName("panic"));
        assertEquals(LogLevel.INFO, LogLevel.fromName("trace"));
        assertEquals(LogLevel.DEBUG, LogLevel.fromPino(10));
        assertEquals(LogLevel.ERROR, LogLevel.fromPino(60));
    }
}
