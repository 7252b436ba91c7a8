package dev.hack.logs.source;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import java.util.function.Consumer;

/**
 * A backend producing canonical entries. Compose and Loki sources share this contract so
 * callers never branch on the backend type.
 *
 * <p>Entries may be delivered from background threads, and from more than one thread at a
 * time (compose drains stdout and stderr concurrently). Callers serialize as needed.
 */
public interface LogSource {
    LogBackend backend();

    /**
     * Begins producing entries. Failures that prevent the source from running at all (spawn
     * failure, unreachable endpoint, rejected query) are thrown here.
     */
    void start(Consumer<LogEntry> entries) throws LogSourceException;

    /**
     * Blocks until the source has delivered its last entry.
     */
    SourceTermination awaitTermination() throws InterruptedException;

    /**
     * Requests cancellation; safe to call repeatedly and before or after termination.
     */
    void stop();
}
