package dev.hack.logs.stream;

import dev.hack.logs.api.LogEntry;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One element of the NDJSON log stream: {@code start}, {@code log}, {@code heartbeat},
 * {@code error} or {@code end}.
 */
public interface LogStreamEvent {
    Type type();

    String ts();

    LogStreamContext context();

    Map<String, Object> toSerializableMap();

    enum Type {
        START,
        LOG,
        HEARTBEAT,
        ERROR,
        END;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    record Start(String ts, LogStreamContext context) implements LogStreamEvent {
        @Override
        public Type type() {
            return Type.START;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("type", type().wireName());
            out.put("ts", ts);
            putIfPresent(out, "project", context.project());
            out.put("backend", context.backend().wireName());
            putIfPresent(out, "branch", context.branch());
            if (!context.services().isEmpty()) {
                out.put("services", context.services());
            }
            out.put("follow", context.follow());
            putIfPresent(out, "since", context.since());
            putIfPresent(out, "until", context.until());
            return out;
        }
    }

    record Log(String ts, LogStreamContext context, LogEntry entry) implements LogStreamEvent {
        public Log {
            Objects.requireNonNull(entry, "entry");
        }

        @Override
        public Type type() {
            return Type.LOG;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            Map<String, Object> out = header(this);
            out.put("entry", entry.toSerializableMap());
            return out;
        }
    }

    record Heartbeat(String ts, LogStreamContext context) implements LogStreamEvent {
        @Override
        public Type type() {
            return Type.HEARTBEAT;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            return header(this);
        }
    }

    record Error(String ts, LogStreamContext context, String message) implements LogStreamEvent {
        public Error {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Type type() {
            return Type.ERROR;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            Map<String, Object> out = header(this);
            out.put("message", message);
            return out;
        }
    }

    record End(String ts, LogStreamContext context, String reason) implements LogStreamEvent {
        @Override
        public Type type() {
            return Type.END;
        }

        @Override
        public Map<String, Object> toSerializableMap() {
            Map<String, Object> out = header(this);
            putIfPresent(out, "reason", reason);
            return out;
        }
    }

    private static Map<String, Object> header(LogStreamEvent event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", event.type().wireName());
        out.put("ts", event.ts());
        putIfPresent(out, "project", event.context().project());
        out.put("backend", event.context().backend().wireName());
        putIfPresent(out, "branch", event.context().branch());
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, String value) {
        if (value != null && !value.isEmpty()) {
            out.put(key, value);
        }
    }
}
