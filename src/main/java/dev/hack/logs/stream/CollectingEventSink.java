package dev.hack.logs.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps events in memory for callers that consume a session as a value (dashboards, tool calls).
 */
public final class CollectingEventSink implements LogEventSink {
    private final List<LogStreamEvent> events = new ArrayList<>();

    @Override
    public synchronized void accept(LogStreamEvent event) {
        events.add(event);
    }

    public synchronized List<LogStreamEvent> events() {
        return List.copyOf(events);
    }
}
