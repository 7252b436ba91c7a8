package dev.hack.logs.session;

import dev.hack.logs.source.LogSource;
import dev.hack.logs.stream.CollectingEventSink;
import dev.hack.logs.stream.LogStreamEvent;
import dev.hack.logs.stream.LogStreamEvents;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs a session until it ends on its own, reaches {@code maxEvents} log events, or exceeds
 * {@code maxDuration}, and returns what was seen as one value.
 */
public final class LogTailCollector {
    public static final int DEFAULT_MAX_EVENTS = 200;
    public static final Duration DEFAULT_MAX_DURATION = Duration.ofSeconds(5);

    static final String MAX_EVENTS = "max_events";
    static final String TIMEOUT = "timeout";

    private final int maxEvents;
    private final Duration maxDuration;

    public LogTailCollector() {
        this(DEFAULT_MAX_EVENTS, DEFAULT_MAX_DURATION);
    }

    public LogTailCollector(int maxEvents, Duration maxDuration) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive");
        }
        Objects.requireNonNull(maxDuration, "maxDuration");
        if (maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }
        this.maxEvents = maxEvents;
        this.maxDuration = maxDuration;
    }

    public TailCollection collect(LogSource source, LogStreamEvents events) {
        var collected = new CollectingEventSink();
        var stderr = new ByteArrayOutputStream();
        try (var diagnostics = new PrintStream(stderr, true, StandardCharsets.UTF_8)) {
            var session = new LogSession(source, events, collected, diagnostics, maxEvents, MAX_EVENTS);
            var timer = CompletableFuture.runAsync(
                () -> session.stop(TIMEOUT),
                CompletableFuture.delayedExecutor(maxDuration.toMillis(), TimeUnit.MILLISECONDS)
            );
            SessionResult result;
            try {
                result = session.run();
            } finally {
                timer.cancel(false);
            }
            return new TailCollection(
                collected.events(),
                result,
                stderr.toString(StandardCharsets.UTF_8)
            );
        }
    }

    /**
     * Events seen by one bounded run. {@link #stopReason()} is the {@code end} reason:
     * {@code max_events}, {@code timeout}, or whatever the source reported.
     */
    public record TailCollection(List<LogStreamEvent> events, SessionResult result, String stderr) {
        public TailCollection {
            events = List.copyOf(events);
        }

        public String stopReason() {
            return result.endReason();
        }

        public long durationMs() {
            return result.duration().toMillis();
        }

        public Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("events", events.stream().map(LogStreamEvent::toSerializableMap).toList());
            map.put("count", events.size());
            map.put("stop_reason", stopReason());
            map.put("duration_ms", durationMs());
            map.put("exit_code", result.exitCode());
            if (!stderr.isBlank()) {
                map.put("stderr", stderr.strip());
            }
            return map;
        }
    }
}
