package dev.hack.logs.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical log record shared by every backend and every consumer.
 *
 * <p>{@code message} and {@code raw} are always present; everything else is derived on a
 * best-effort basis and may be {@code null}.
 */
public record LogEntry(
    LogBackend source,
    String message,
    String raw,
    StdStream stream,
    String project,
    String service,
    String instance,
    Map<String, String> labels,
    String timestamp,
    String timestampNs,
    LogLevel level,
    Map<String, String> fields
) {
    public LogEntry {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(raw, "raw");
        labels = labels == null || labels.isEmpty()
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        fields = fields == null || fields.isEmpty()
            ? null
            : Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public static Builder builder(LogBackend source) {
        return new Builder(source);
    }

    public Optional<LogLevel> levelOpt() {
        return Optional.ofNullable(level);
    }

    public Optional<String> timestampOpt() {
        return Optional.ofNullable(timestamp);
    }

    /**
     * Key order follows the wire schema; absent values are left out.
     */
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("source", source.wireName());
        out.put("message", message);
        out.put("raw", raw);
        putIfPresent(out, "stream", stream == null ? null : stream.wireName());
        putIfPresent(out, "project", project);
        putIfPresent(out, "service", service);
        putIfPresent(out, "instance", instance);
        putIfPresent(out, "labels", labels);
        putIfPresent(out, "timestamp_ns", timestampNs);
        putIfPresent(out, "timestamp", timestamp);
        putIfPresent(out, "level", level == null ? null : level.wireName());
        putIfPresent(out, "fields", fields);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }

    public static final class Builder {
        private final LogBackend source;
        private String message;
        private String raw;
        private StdStream stream;
        private String project;
        private String service;
        private String instance;
        private Map<String, String> labels;
        private String timestamp;
        private String timestampNs;
        private LogLevel level;
        private Map<String, String> fields;

        private Builder(LogBackend source) {
            this.source = source;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder raw(String raw) {
            this.raw = raw;
            return this;
        }

        public Builder stream(StdStream stream) {
            this.stream = stream;
            return this;
        }

        public Builder project(String project) {
            this.project = blankToNull(project);
            return this;
        }

        public Builder service(String service) {
            this.service = blankToNull(service);
            return this;
        }

        public Builder instance(String instance) {
            this.instance = blankToNull(instance);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = blankToNull(timestamp);
            return this;
        }

        public Builder timestampNs(String timestampNs) {
            this.timestampNs = blankToNull(timestampNs);
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder fields(Map<String, String> fields) {
            this.fields = fields;
            return this;
        }

        public LogEntry build() {
            return new LogEntry(
                source,
                message,
                raw,
                stream,
                project,
                service,
                instance,
                labels,
                timestamp,
                timestampNs,
                level,
                fields
            );
        }

        private static String blankToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
