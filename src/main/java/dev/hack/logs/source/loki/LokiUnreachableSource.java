package dev.hack.logs.source.loki;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import java.util.function.Consumer;

/**
 * Stands in for Loki when it was explicitly requested but did not answer the readiness probe.
 */
public final class LokiUnreachableSource implements LogSource {
    private final String baseUrl;

    public LokiUnreachableSource(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    @Override
    public LogBackend backend() {
        return LogBackend.LOKI;
    }

    @Override
    public void start(Consumer<LogEntry> entries) throws LogSourceException {
        throw new LogSourceException("Loki is not reachable at " + baseUrl + ".", LokiSnapshotSource.TIP, null);
    }

    @Override
    public SourceTermination awaitTermination() {
        return SourceTermination.failed("Loki is not reachable at " + baseUrl + ".");
    }

    @Override
    public void stop() {
        // nothing was started
    }
}
