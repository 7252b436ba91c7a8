package dev.hack.logs.session;

import dev.hack.logs.api.LogEntry;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import dev.hack.logs.stream.LogEventSink;
import dev.hack.logs.stream.LogStreamEvent;
import dev.hack.logs.stream.LogStreamEvents;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one source from {@code start} to {@code end} and wraps every entry in the stream
 * envelope.
 *
 * <p>The sink is only entered while holding the session lock, so sources that deliver from
 * several threads never reach it concurrently. The first {@link #stop(String)} wins: its reason
 * becomes the {@code end} reason and no entry is delivered after it.
 */
public final class LogSession {
    private static final Logger log = LoggerFactory.getLogger(LogSession.class);

    private final LogSource source;
    private final LogStreamEvents events;
    private final LogEventSink sink;
    private final PrintStream diagnostics;
    private final long entryLimit;
    private final String limitReason;
    private final Object lock = new Object();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile String stopReason;
    private long delivered;

    public LogSession(LogSource source, LogStreamEvents events, LogEventSink sink, PrintStream diagnostics) {
        this(source, events, sink, diagnostics, Long.MAX_VALUE, null);
    }

    /**
     * Session that stops itself with {@code limitReason} once {@code entryLimit} log events have
     * reached the sink.
     */
    public LogSession(
        LogSource source,
        LogStreamEvents events,
        LogEventSink sink,
        PrintStream diagnostics,
        long entryLimit,
        String limitReason
    ) {
        if (entryLimit <= 0) {
            throw new IllegalArgumentException("entryLimit must be positive");
        }
        this.source = source;
        this.events = events;
        this.sink = sink;
        this.diagnostics = diagnostics;
        this.entryLimit = entryLimit;
        this.limitReason = limitReason;
    }

    public SessionResult run() {
        Instant started = Instant.now();
        try {
            emit(events.start());
            try {
                source.start(this::deliver);
            } catch (LogSourceException ex) {
                report(ex.getMessage(), ex.hint());
                return fail(ex.getMessage(), started);
            }
            SourceTermination termination = awaitSource();
            if (termination.failed()) {
                String message = termination.error().get();
                report(message, null);
                return fail(message, started);
            }
            String reason = stopReason != null ? stopReason : termination.reason();
            emit(events.end(reason));
            if (stopReason != null) {
                return SessionResult.stopped(reason, deliveredCount(), started);
            }
            if (termination.exitCode() != 0) {
                return SessionResult.failure(reason, null, deliveredCount(), started);
            }
            return SessionResult.success(reason, deliveredCount(), started);
        } finally {
            finished.countDown();
        }
    }

    /**
     * Stops the session. Returns {@code false} when an earlier stop already decided the reason.
     *
     * @param reason {@code end} reason to report, or {@code null} to keep the source's own
     */
    public boolean stop(String reason) {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        stopReason = reason;
        log.debug("Stopping {} session ({})", source.backend().wireName(), reason == null ? "signal" : reason);
        source.stop();
        return true;
    }

    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private SourceTermination awaitSource() {
        try {
            return source.awaitTermination();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            stop(null);
            return SourceTermination.of("closed", 0);
        }
    }

    private void deliver(LogEntry entry) {
        synchronized (lock) {
            if (stopped.get()) {
                return;
            }
            delivered++;
            sink.accept(events.log(entry));
            if (delivered >= entryLimit) {
                stop(limitReason);
            }
        }
    }

    private SessionResult fail(String message, Instant started) {
        emit(events.error(message));
        emit(events.end("error"));
        return SessionResult.failure("error", message, deliveredCount(), started);
    }

    private void emit(LogStreamEvent event) {
        synchronized (lock) {
            sink.accept(event);
        }
    }

    private long deliveredCount() {
        synchronized (lock) {
            return delivered;
        }
    }

    private void report(String message, String hint) {
        diagnostics.println(message);
        if (hint != null) {
            diagnostics.println(hint);
        }
    }
}
