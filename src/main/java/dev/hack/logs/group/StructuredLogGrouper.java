package dev.hack.logs.group;

import dev.hack.logs.parse.ComposePrefix;
import dev.hack.logs.parse.TimestampPrefix;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-joins JSON records that a container printed across several lines.
 *
 * <p>Buffers are keyed by compose service label, one per key. A buffer is flushed when its
 * contents parse as JSON, when a non-continuation line arrives for the same key, when it hits
 * {@link #MAX_JSON_LINES} lines or {@link #MAX_JSON_CHARS} characters, or on {@link #flush()}.
 * Instances are not thread-safe: each one belongs to the task draining a single stream.
 */
public final class StructuredLogGrouper {
    public static final int MAX_JSON_LINES = 200;
    public static final int MAX_JSON_CHARS = 64_000;

    private static final Logger log = LoggerFactory.getLogger(StructuredLogGrouper.class);

    private final Consumer<LineGroup> output;
    private final Map<String, GroupBuffer> buffers = new LinkedHashMap<>();

    public StructuredLogGrouper(Consumer<LineGroup> output) {
        this.output = output;
    }

    public void handleLine(String line) {
        Optional<ComposePrefix> split = ComposePrefix.split(line);
        if (split.isEmpty()) {
            output.accept(LineGroup.single(line, line));
            return;
        }
        String key = split.get().label();
        String payload = TimestampPrefix.split(split.get().payload()).payload();
        String trimmed = payload.trim();

        GroupBuffer buffer = buffers.get(key);
        if (buffer != null) {
            if (JsonHeuristics.looksLikeJsonContinuation(trimmed)) {
                buffer.append(line, payload);
                if (buffer.jsonLines.size() >= MAX_JSON_LINES || buffer.size >= MAX_JSON_CHARS) {
                    log.debug("Forcing flush of {} buffered lines for {}", buffer.jsonLines.size(), key);
                    flushBuffer(key);
                } else if (JsonHeuristics.isJsonComplete(buffer.jsonLines)) {
                    flushBuffer(key);
                }
                return;
            }
            flushBuffer(key);
        }

        if (JsonHeuristics.looksLikeJsonStart(trimmed) && !JsonHeuristics.isJsonComplete(List.of(payload))) {
            GroupBuffer opened = new GroupBuffer();
            opened.append(line, payload);
            buffers.put(key, opened);
            return;
        }
        output.accept(LineGroup.single(line, payload));
    }

    /**
     * Emits every open buffer; called once the underlying stream ends.
     */
    public void flush() {
        for (String key : new ArrayList<>(buffers.keySet())) {
            flushBuffer(key);
        }
    }

    int openBuffers() {
        return buffers.size();
    }

    private void flushBuffer(String key) {
        GroupBuffer buffer = buffers.remove(key);
        if (buffer != null) {
            output.accept(new LineGroup(buffer.rawLines, buffer.jsonLines));
        }
    }

    private static final class GroupBuffer {
        private final List<String> rawLines = new ArrayList<>();
        private final List<String> jsonLines = new ArrayList<>();
        private int size;

        void append(String rawLine, String jsonLine) {
            rawLines.add(rawLine);
            jsonLines.add(jsonLine);
            size += jsonLine.length();
        }
    }
}
