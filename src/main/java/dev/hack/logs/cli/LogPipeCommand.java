package dev.hack.logs.cli;

import dev.hack.logs.api.LogEntry;
import dev.hack.logs.api.StdStream;
import dev.hack.logs.format.Ansi;
import dev.hack.logs.format.PrettyLogFormatter;
import dev.hack.logs.parse.ComposeLineParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import picocli.CommandLine;

@CommandLine.Command(
    name = "log-pipe",
    description = "Read log lines from stdin and pretty-print them (best-effort JSON parsing).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LogPipeCommand implements Callable<Integer> {
    enum InputFormat {
        AUTO("auto"),
        DOCKER_COMPOSE("docker-compose"),
        PLAIN("plain");

        private final String wireName;

        InputFormat(String wireName) {
            this.wireName = wireName;
        }

        static InputFormat parse(String raw) {
            String value = raw == null ? "auto" : raw.trim();
            for (InputFormat format : values()) {
                if (format.wireName.equals(value)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("Invalid --format: " + value);
        }
    }

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final BooleanSupplier stdinIsTerminal;
    private final boolean color;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--format",
        paramLabel = "auto|docker-compose|plain",
        description = "How to parse incoming lines from stdin."
    )
    private String format = "auto";

    @CommandLine.Option(
        names = "--stream",
        paramLabel = "stdout|stderr",
        description = "Treat stdin as stdout or stderr (stderr forces ERROR level and writes to stderr)."
    )
    private String stream = "stdout";

    LogPipeCommand() {
        this(
            System.in,
            System.out,
            System.err,
            () -> System.console() != null,
            Ansi.enabled(System.console() != null, System.getenv())
        );
    }

    LogPipeCommand(InputStream in, PrintStream out, PrintStream err, BooleanSupplier stdinIsTerminal, boolean color) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.stdinIsTerminal = stdinIsTerminal;
        this.color = color;
    }

    @Override
    public Integer call() throws IOException {
        InputFormat inputFormat;
        StdStream target;
        try {
            inputFormat = InputFormat.parse(format);
            target = parseStream(stream);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
        if (stdinIsTerminal.getAsBoolean()) {
            err.println("No stdin detected. Pipe logs into this command.");
            return 1;
        }
        var formatter = new PrettyLogFormatter(color);
        PrintStream sink = target == StdStream.STDERR ? err : out;
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LogEntry entry = inputFormat == InputFormat.PLAIN
                    ? ComposeLineParser.parseUnprefixed(line, target)
                    : ComposeLineParser.parse(line, target, null);
                sink.println(formatter.format(entry));
            }
        }
        sink.flush();
        return 0;
    }

    private static StdStream parseStream(String raw) {
        String value = raw == null ? "stdout" : raw.trim();
        return switch (value) {
            case "stdout" -> StdStream.STDOUT;
            case "stderr" -> StdStream.STDERR;
            default -> throw new IllegalArgumentException("Invalid --stream: " + value);
        };
    }
}
