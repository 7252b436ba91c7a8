package dev.hack.logs.stream;

import dev.hack.logs.api.LogEntry;
import dev.hack.logs.shared.Timestamps;
import java.time.Clock;

/**
 * Event constructors bound to one session context.
 */
public final class LogStreamEvents {
    private final LogStreamContext context;
    private final Clock clock;

    public LogStreamEvents(LogStreamContext context) {
        this(context, Clock.systemUTC());
    }

    public LogStreamEvents(LogStreamContext context, Clock clock) {
        this.context = context;
        this.clock = clock;
    }

    public LogStreamContext context() {
        return context;
    }

    public LogStreamEvent start() {
        return new LogStreamEvent.Start(now(), context);
    }

    /**
     * Uses the entry's own timestamp when it has one so replay order follows source time.
     */
    public LogStreamEvent log(LogEntry entry) {
        return new LogStreamEvent.Log(entry.timestampOpt().orElseGet(this::now), context, entry);
    }

    public LogStreamEvent heartbeat() {
        return new LogStreamEvent.Heartbeat(now(), context);
    }

    public LogStreamEvent error(String message) {
        return new LogStreamEvent.Error(now(), context, message);
    }

    public LogStreamEvent end(String reason) {
        return new LogStreamEvent.End(now(), context, reason);
    }

    private String now() {
        return Timestamps.formatIso(clock.instant());
    }
}
