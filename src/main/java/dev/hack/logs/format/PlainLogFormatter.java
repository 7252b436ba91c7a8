package dev.hack.logs.format;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.parse.ComposePrefix;
import java.util.stream.Collectors;

/**
 * Compose-style rendering {@code <label> | <timestamp> <payload>} with the payload untouched.
 */
public final class PlainLogFormatter {
    private PlainLogFormatter() {}

    public static String format(LogEntry entry) {
        String label = EntryLabels.of(entry);
        if (entry.source() == LogBackend.LOKI) {
            String ts = entry.timestampOpt().map(value -> value + " ").orElse("");
            return label + " | " + ts + entry.raw();
        }
        // compose raw lines already carry the docker timestamp after the prefix
        return entry.raw().lines()
            .map(line -> ComposePrefix.split(line).map(prefix -> label + " | " + prefix.payload()).orElse(line))
            .collect(Collectors.joining("\n"));
    }
}
