package dev.hack.logs.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogLevel;
import dev.hack.logs.api.LogEntry;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PrettyLogFormatterTest {
    private final PrettyLogFormatter plain = new PrettyLogFormatter(false);

    @Test
    void rendersAllTags() {
        var entry = LogEntry.builder(LogBackend.COMPOSE)
            .message("request done")
            .raw("x")
            .project("shop")
            .service("api")
            .instance("2")
            .timestamp("2025-12-30T03:30:48.866123Z")
            .level(LogLevel.WARN)
            .fields(Map.of("status", "500", "path", "/orders"))
            .build();

        assertEquals(
            "[03:30:48.866] [WARN] [shop/api#2] request done path=/orders status=500",
            plain.format(entry)
        );
    }

    @Test
    void composeWithoutPrefixHasNoLabel() {
        var entry = LogEntry.builder(LogBackend.COMPOSE).message("bare").raw("bare").build();

        assertEquals("bare", plain.format(entry));
    }

    @Test
    void lokiAlwaysHasLabel() {
        var fromLabels = LogEntry.builder(LogBackend.LOKI).message("m").raw("m").labels(Map.of("service", "web")).build();
        var unlabeled = LogEntry.builder(LogBackend.LOKI).message("m").raw("m").build();

        assertEquals("[web] m", plain.format(fromLabels));
        assertEquals("[service] m", plain.format(unlabeled));
    }

    @Test
    void clockPadsAndTruncatesFraction() {
        assertEquals("03:30:48", PrettyLogFormatter.clock("2025-12-30T03:30:48Z"));
        assertEquals("03:30:48.500", PrettyLogFormatter.clock("2025-12-30T03:30:48.5Z"));
        assertEquals("03:30:48.123", PrettyLogFormatter.clock("2025-12-30T03:30:48.123456789Z"));
        assertEquals("garbage", PrettyLogFormatter.clock("garbage"));
    }

    @Test
    void colorKeepsLabelStable() {
        var colored = new PrettyLogFormatter(true);
        var entry = LogEntry.builder(LogBackend.COMPOSE).message("m").raw("m").service("api").instance("1").level(LogLevel.ERROR).build();

        String first = colored.format(entry);
        assertEquals(first, colored.format(entry));
        assertTrue(first.contains(Ansi.RED + "ERROR"));
        assertTrue(first.contains(Ansi.hashed("api")));
        assertFalse(first.contains("api#1"));
    }

    @Test
    void colorRequiresTerminalAndNoOptOut() {
        assertTrue(Ansi.enabled(true, Map.of()));
        assertFalse(Ansi.enabled(false, Map.of()));
        assertFalse(Ansi.enabled(true, Map.of("HACK_NO_COLOR", "TRUE")));
        assertTrue(Ansi.enabled(true, Map.of("HACK_NO_COLOR", "0")));
    }
}
