package dev.hack.logs.format;

import dev.hack.logs.api.OutputFormat;
import dev.hack.logs.api.StdStream;
import dev.hack.logs.stream.LogEventSink;
import dev.hack.logs.stream.LogStreamEvent;
import java.io.PrintStream;

/**
 * Prints log events as text. Entries read from a container's stderr go to {@code err}; lifecycle
 * events are not printed because failures are already reported on stderr by the session.
 */
public final class TextEventSink implements LogEventSink {
    private final OutputFormat format;
    private final PrettyLogFormatter pretty;
    private final PrintStream out;
    private final PrintStream err;

    public TextEventSink(OutputFormat format, boolean color, PrintStream out, PrintStream err) {
        if (format == OutputFormat.JSON) {
            throw new IllegalArgumentException("JSON output uses NdjsonEventSink");
        }
        this.format = format;
        this.pretty = new PrettyLogFormatter(color);
        this.out = out;
        this.err = err;
    }

    @Override
    public void accept(LogStreamEvent event) {
        if (!(event instanceof LogStreamEvent.Log log)) {
            return;
        }
        var entry = log.entry();
        String text = format == OutputFormat.PRETTY ? pretty.format(entry) : PlainLogFormatter.format(entry);
        PrintStream target = entry.stream() == StdStream.STDERR ? err : out;
        target.println(text);
        target.flush();
    }
}
