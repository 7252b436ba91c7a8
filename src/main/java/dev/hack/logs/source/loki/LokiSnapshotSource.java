package dev.hack.logs.source.loki;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.parse.LokiLineParser;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import java.math.BigInteger;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Bounded historical query against {@code query_range}. Entries are delivered oldest first
 * whatever order Loki returned them in.
 */
public final class LokiSnapshotSource implements LogSource {
    static final Duration DEFAULT_WINDOW = Duration.ofMinutes(15);
    static final String TIP = "Tip: run `hack global install` (or `hack global up`) and ensure Loki is reachable.";

    private final LokiClient client;
    private final String query;
    private final int limit;
    private final Instant start;
    private final Instant end;
    private final Clock clock;
    private volatile boolean stopRequested;
    private volatile CompletableFuture<HttpResponse<String>> pending;

    public LokiSnapshotSource(LokiClient client, String query, int limit, Instant start, Instant end) {
        this(client, query, limit, start, end, Clock.systemUTC());
    }

    public LokiSnapshotSource(LokiClient client, String query, int limit, Instant start, Instant end, Clock clock) {
        this.client = client;
        this.query = query;
        this.limit = limit;
        this.start = start;
        this.end = end;
        this.clock = clock;
    }

    @Override
    public LogBackend backend() {
        return LogBackend.LOKI;
    }

    @Override
    public void start(Consumer<LogEntry> entries) throws LogSourceException {
        Instant windowEnd = end != null ? end : clock.instant();
        Instant windowStart = start != null ? start : windowEnd.minus(DEFAULT_WINDOW);
        HttpResponse<String> response;
        pending = client.queryRange(query, limit, windowStart, windowEnd);
        if (stopRequested) {
            pending.cancel(true);
        }
        try {
            response = pending.get();
        } catch (CancellationException ex) {
            return;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (stopRequested) {
                return;
            }
            throw new LogSourceException(
                "Failed to connect to Loki at " + client.baseUrl() + ": " + describe(cause),
                TIP,
                cause
            );
        } catch (InterruptedException ex) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new LogSourceException("Interrupted while querying Loki", null, ex);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LogSourceException(
                "Failed to query Loki (" + response.statusCode() + "): " + response.body().trim()
            );
        }
        var parsed = LokiResponses.parseQueryRange(response.body())
            .orElseThrow(() -> new LogSourceException("Failed to parse Loki query response"));
        if (!parsed.success()) {
            throw new LogSourceException("Loki error: " + (parsed.error() != null ? parsed.error() : "unknown error"));
        }
        for (LogEntry entry : chronological(parsed.streams())) {
            if (stopRequested) {
                return;
            }
            entries.accept(entry);
        }
    }

    @Override
    public SourceTermination awaitTermination() {
        return SourceTermination.of(stopRequested ? "closed" : "eof", 0);
    }

    @Override
    public void stop() {
        stopRequested = true;
        var request = pending;
        if (request != null) {
            request.cancel(true);
        }
    }

    /**
     * BACKWARD queries arrive newest first per stream; flatten, reverse, then stable-sort by
     * timestamp so interleaved streams come out in order too.
     */
    static List<LogEntry> chronological(List<LokiStream> streams) {
        List<LogEntry> flattened = new ArrayList<>();
        for (LokiStream stream : streams) {
            for (LokiStream.LokiValue value : stream.values()) {
                flattened.add(LokiLineParser.parse(stream.labels(), value.timestampNs(), value.line()));
            }
        }
        Collections.reverse(flattened);
        flattened.sort(Comparator.comparing(LokiSnapshotSource::sortKey));
        return flattened;
    }

    private static BigInteger sortKey(LogEntry entry) {
        if (entry.timestampNs() == null) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(entry.timestampNs().trim());
        } catch (NumberFormatException ex) {
            return BigInteger.ZERO;
        }
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
