package dev.hack.logs.stream;

/**
 * Receives the events of a session. Sessions never call a sink concurrently.
 */
@FunctionalInterface
public interface LogEventSink {
    void accept(LogStreamEvent event);
}
