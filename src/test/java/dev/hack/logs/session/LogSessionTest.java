package dev.hack.logs.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import dev.hack.logs.stream.CollectingEventSink;
import dev.hack.logs.stream.LogStreamContext;
import dev.hack.logs.stream.LogStreamEvent;
import dev.hack.logs.stream.LogStreamEvents;
import dev.hack.logs.support.ScriptedSource;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LogSessionTest {
    private final CollectingEventSink sink = new CollectingEventSink();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final PrintStream diagnostics = new PrintStream(stderr, true, StandardCharsets.UTF_8);

    private LogSession session(ScriptedSource source) {
        var events = new LogStreamEvents(new LogStreamContext(source.backend(), "shop", null, null, false, null, null));
        return new LogSession(source, events, sink, diagnostics);
    }

    private List<String> types() {
        return sink.events().stream().map(e -> e.type().wireName()).collect(Collectors.toList());
    }

    @Test
    void wrapsEntriesBetweenStartAndEnd() {
        var result = session(ScriptedSource.of(LogBackend.LOKI, "a", "b")).run();

        assertEquals(List.of("start", "log", "log", "end"), types());
        assertEquals("eof", ((LogStreamEvent.End) sink.events().get(3)).reason());
        assertEquals(SessionResult.Status.SUCCESS, result.status());
        assertEquals(2, result.entries());
        assertEquals(0, result.exitCode());
    }

    @Test
    void startFailureEmitsErrorThenEnd() {
        var source = ScriptedSource.of(LogBackend.LOKI)
            .failingWith(new LogSourceException("Loki is not reachable at http://127.0.0.1:3100.", "Tip: start Loki.", null));

        var result = session(source).run();

        assertEquals(List.of("start", "error", "end"), types());
        assertEquals("Loki is not reachable at http://127.0.0.1:3100.", ((LogStreamEvent.Error) sink.events().get(1)).message());
        assertEquals("error", ((LogStreamEvent.End) sink.events().get(2)).reason());
        assertEquals(1, result.exitCode());
        assertEquals("error", result.endReason());
        String printed = stderr.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Loki is not reachable"));
        assertTrue(printed.contains("Tip: start Loki."));
    }

    @Test
    void midStreamFailureEmitsErrorAfterEntries() {
        var source = ScriptedSource.of(LogBackend.LOKI, "a")
            .endingWith(SourceTermination.failed("Loki WebSocket error: reset"));

        var result = session(source).run();

        assertEquals(List.of("start", "log", "error", "end"), types());
        assertEquals(SessionResult.Status.FAILURE, result.status());
        assertEquals("Loki WebSocket error: reset", result.error().orElseThrow());
    }

    @Test
    void nonZeroExitEndsWithExitReason() {
        var source = ScriptedSource.of(LogBackend.COMPOSE, "boom").endingWith(SourceTermination.of("exit:14", 14));

        var result = session(source).run();

        assertEquals(List.of("start", "log", "end"), types());
        assertEquals("exit:14", ((LogStreamEvent.End) sink.events().get(2)).reason());
        assertEquals(1, result.exitCode());
    }

    @Test
    void firstStopDecidesReason() throws Exception {
        var source = ScriptedSource.of(LogBackend.LOKI, "a").following();
        var session = session(source);
        var running = CompletableFuture.supplyAsync(session::run);
        while (sink.events().size() < 2) {
            Thread.sleep(5);
        }

        assertTrue(session.stop("max_events"));
        assertFalse(session.stop("timeout"));
        var result = running.get(5, TimeUnit.SECONDS);

        assertEquals(SessionResult.Status.STOPPED, result.status());
        assertEquals("max_events", result.endReason());
        assertEquals("max_events", ((LogStreamEvent.End) sink.events().get(2)).reason());
        assertEquals(1, source.stopCalls());
        assertTrue(session.awaitFinished(Duration.ofSeconds(1)));
    }

    @Test
    void signalStopKeepsSourceReason() throws Exception {
        var source = ScriptedSource.of(LogBackend.COMPOSE).following();
        var session = session(source);
        var running = CompletableFuture.supplyAsync(session::run);
        while (sink.events().isEmpty()) {
            Thread.sleep(5);
        }

        session.stop(null);
        var result = running.get(5, TimeUnit.SECONDS);

        assertEquals("closed", result.endReason());
        assertEquals(0, result.exitCode());
    }

    @Test
    void entryLimitStopsSessionWithLimitReason() throws Exception {
        var source = ScriptedSource.of(LogBackend.LOKI, "a", "b", "c").following();
        var events = new LogStreamEvents(new LogStreamContext(source.backend(), "shop", null, null, true, null, null));
        var session = new LogSession(source, events, sink, diagnostics, 2, "max_events");

        var result = CompletableFuture.supplyAsync(session::run).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("start", "log", "log", "end"), types());
        assertEquals("max_events", result.endReason());
        assertEquals(2, result.entries());
        assertEquals(1, source.stopCalls());
    }
}
