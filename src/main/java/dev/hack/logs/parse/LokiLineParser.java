package dev.hack.logs.parse;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.shared.Timestamps;
import java.util.Map;

/**
 * Normalizes one Loki stream value ({@code [tsNs, line]} plus the stream's labels).
 */
public final class LokiLineParser {
    private LokiLineParser() {}

    public static LogEntry parse(Map<String, String> labels, String timestampNs, String line) {
        ParsedPayload parsed = LogPayloadParser.parse(line);
        return LogEntry.builder(LogBackend.LOKI)
            .message(parsed.message())
            .raw(line)
            .project(labels.get("project"))
            .service(labels.get("service"))
            .labels(labels)
            .timestampNs(timestampNs)
            .timestamp(Timestamps.nanosToIso(timestampNs).orElse(null))
            .level(parsed.level())
            .fields(parsed.fields())
            .build();
    }
}
