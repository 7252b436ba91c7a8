package dev.hack.logs.stream;

import java.io.PrintStream;

/**
 * Writes every event as one NDJSON line.
 */
public final class NdjsonEventSink implements LogEventSink {
    private final PrintStream out;

    public NdjsonEventSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void accept(LogStreamEvent event) {
        out.print(NdjsonWriter.toLine(event));
        out.print('\n');
        out.flush();
    }
}
