package dev.hack.logs.parse;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.api.LogLevel;
import dev.hack.logs.api.StdStream;
import dev.hack.logs.group.LineGroup;
import java.util.Optional;

/**
 * Normalizes {@code docker compose logs --timestamps} output into {@link LogEntry} values.
 */
public final class ComposeLineParser {
    private ComposeLineParser() {}

    public static LogEntry parse(String line, StdStream stream, String projectName) {
        Optional<ComposePrefix> split = ComposePrefix.split(line);
        String payload = split.map(ComposePrefix::payload).orElse(line);
        TimestampPrefix stamped = TimestampPrefix.split(payload);
        return build(line, split, stamped.timestamp(), stamped.payload(), stream, projectName);
    }

    /**
     * Parses a line that carries no {@code <label> |} prefix, only an optional timestamp.
     */
    public static LogEntry parseUnprefixed(String line, StdStream stream) {
        TimestampPrefix stamped = TimestampPrefix.split(line);
        return build(line, Optional.empty(), stamped.timestamp(), stamped.payload(), stream, null);
    }

    /**
     * Normalizes a grouper flush. Multi-line groups become one entry whose payload is the
     * re-joined JSON text; prefix metadata comes from the first line.
     */
    public static LogEntry parse(LineGroup group, StdStream stream, String projectName) {
        if (group.isSingleLine()) {
            return parse(group.rawLines().get(0), stream, projectName);
        }
        String first = group.rawLines().get(0);
        Optional<ComposePrefix> split = ComposePrefix.split(first);
        String timestamp = split.map(prefix -> TimestampPrefix.split(prefix.payload()).timestamp()).orElse(null);
        return build(group.joinedRaw(), split, timestamp, group.joinedJson(), stream, projectName);
    }

    private static LogEntry build(
        String raw,
        Optional<ComposePrefix> split,
        String timestamp,
        String payload,
        StdStream stream,
        String projectName
    ) {
        ParsedPayload parsed = LogPayloadParser.parse(payload);
        LogLevel level = stream == StdStream.STDERR ? LogLevel.ERROR : parsed.level();
        var builder = LogEntry.builder(LogBackend.COMPOSE)
            .message(parsed.message())
            .raw(raw)
            .stream(stream)
            .project(projectName)
            .timestamp(timestamp)
            .level(level)
            .fields(parsed.fields());
        split.map(prefix -> prefix.serviceInstance(projectName)).ifPresent(info -> builder
            .service(info.service())
            .instance(info.instance()));
        return builder.build();
    }
}
