package dev.hack.logs.source.loki;

import dev.hack.logs.api.LogEntry;
import dev.hack.logs.parse.LokiLineParser;
import dev.hack.logs.source.SourceTermination;
import java.net.http.WebSocket;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns tail frames into entries and records how the socket ended. The first of close,
 * error or an explicit stop decides the termination.
 */
final class LokiTailListener implements WebSocket.Listener {
    private static final Logger log = LoggerFactory.getLogger(LokiTailListener.class);

    private final Consumer<LogEntry> entries;
    private final CompletableFuture<SourceTermination> termination;
    private final BooleanSupplier stopped;
    private final StringBuilder pending = new StringBuilder();

    LokiTailListener(
        Consumer<LogEntry> entries,
        CompletableFuture<SourceTermination> termination,
        BooleanSupplier stopped
    ) {
        this.entries = entries;
        this.termination = termination;
        this.stopped = stopped;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        pending.append(data);
        if (last) {
            String text = pending.toString();
            pending.setLength(0);
            handleMessage(text);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        log.debug("Loki tail closed ({} {})", statusCode, reason);
        termination.complete(SourceTermination.of("closed", 0));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.debug("Loki tail socket failed", error);
        String detail = error.getMessage() != null ? ": " + error.getMessage() : "";
        termination.complete(SourceTermination.failed("Loki WebSocket error" + detail));
    }

    void handleMessage(String text) {
        Optional<List<LokiStream>> streams = LokiResponses.parseTailMessage(text);
        if (streams.isEmpty()) {
            log.debug("Skipping malformed Loki tail message ({} chars)", text.length());
            return;
        }
        for (LokiStream stream : streams.get()) {
            for (LokiStream.LokiValue value : stream.values()) {
                if (stopped.getAsBoolean() || termination.isDone()) {
                    return;
                }
                entries.accept(LokiLineParser.parse(stream.labels(), value.timestampNs(), value.line()));
            }
        }
    }
}
