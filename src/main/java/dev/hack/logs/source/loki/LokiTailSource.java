package dev.hack.logs.source.loki;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live follow over the Loki {@code tail} WebSocket. Frames are pushed by the HTTP client's
 * executor; nothing is polled.
 */
public final class LokiTailSource implements LogSource {
    private static final Logger log = LoggerFactory.getLogger(LokiTailSource.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final LokiClient client;
    private final String query;
    private final int limit;
    private final Instant start;
    private final CompletableFuture<SourceTermination> termination = new CompletableFuture<>();

    private volatile WebSocket socket;
    private volatile boolean stopRequested;

    public LokiTailSource(LokiClient client, String query, int limit, Instant start) {
        this.client = client;
        this.query = query;
        this.limit = limit;
        this.start = start;
    }

    @Override
    public LogBackend backend() {
        return LogBackend.LOKI;
    }

    @Override
    public void start(Consumer<LogEntry> entries) throws LogSourceException {
        var uri = client.tailUri(query, limit, start);
        var listener = new LokiTailListener(entries, termination, () -> stopRequested);
        try {
            socket = client.openTail(uri, listener).get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new LogSourceException(
                "Failed to connect to Loki at " + client.baseUrl() + ": " + cause.getMessage(),
                LokiSnapshotSource.TIP,
                cause
            );
        } catch (TimeoutException ex) {
            throw new LogSourceException(
                "Timed out connecting to Loki at " + client.baseUrl(),
                LokiSnapshotSource.TIP,
                ex
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LogSourceException("Interrupted while connecting to Loki", null, ex);
        }
        if (stopRequested) {
            closeSocket();
        }
    }

    @Override
    public SourceTermination awaitTermination() throws InterruptedException {
        try {
            return termination.get();
        } catch (ExecutionException ex) {
            return SourceTermination.failed("Loki tail failed: " + ex.getCause());
        }
    }

    @Override
    public void stop() {
        stopRequested = true;
        closeSocket();
        termination.complete(SourceTermination.of("closed", 0));
    }

    private void closeSocket() {
        WebSocket current = socket;
        if (current == null || current.isOutputClosed()) {
            return;
        }
        current.sendClose(WebSocket.NORMAL_CLOSURE, "")
            .whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("Closing Loki tail failed: {}", error.getMessage());
                }
                current.abort();
            });
    }
}
