package dev.hack.logs.support;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Source replaying fixed entries synchronously from {@link #start}. A following source then
 * blocks in {@link #awaitTermination()} until stopped, like a live tail.
 */
public final class ScriptedSource implements LogSource {
    private final LogBackend backend;
    private final List<LogEntry> entries = new ArrayList<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicInteger stopCalls = new AtomicInteger();
    private boolean following;
    private SourceTermination termination = SourceTermination.of("eof", 0);
    private LogSourceException startFailure;

    private ScriptedSource(LogBackend backend) {
        this.backend = backend;
    }

    public static ScriptedSource of(LogBackend backend, String... messages) {
        var source = new ScriptedSource(backend);
        for (String message : messages) {
            source.entries.add(LogEntry.builder(backend).message(message).raw(message).build());
        }
        return source;
    }

    public ScriptedSource following() {
        this.following = true;
        return this;
    }

    public ScriptedSource endingWith(SourceTermination termination) {
        this.termination = termination;
        return this;
    }

    public ScriptedSource failingWith(LogSourceException failure) {
        this.startFailure = failure;
        return this;
    }

    public int stopCalls() {
        return stopCalls.get();
    }

    @Override
    public LogBackend backend() {
        return backend;
    }

    @Override
    public void start(Consumer<LogEntry> sink) throws LogSourceException {
        if (startFailure != null) {
            throw startFailure;
        }
        for (LogEntry entry : entries) {
            if (stopped.getCount() == 0) {
                return;
            }
            sink.accept(entry);
        }
    }

    @Override
    public SourceTermination awaitTermination() throws InterruptedException {
        if (following) {
            stopped.await();
            return SourceTermination.of("closed", 0);
        }
        return termination;
    }

    @Override
    public void stop() {
        stopCalls.incrementAndGet();
        stopped.countDown();
    }
}
