package dev.hack.logs.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.hack.logs.api.LogsConfiguration;
import dev.hack.logs.api.LogsEnvironment;
import dev.hack.logs.api.LogsRunner;
import dev.hack.logs.api.OutputFormat;
import dev.hack.logs.format.Ansi;
import dev.hack.logs.format.TextEventSink;
import dev.hack.logs.project.ComposeProjectNames;
import dev.hack.logs.project.ProjectConfig;
import dev.hack.logs.project.ProjectConfigLoader;
import dev.hack.logs.project.ProjectContext;
import dev.hack.logs.session.LogSession;
import dev.hack.logs.session.LogTailCollector;
import dev.hack.logs.shared.CsvLists;
import dev.hack.logs.shared.DurationParser;
import dev.hack.logs.shared.TimeRange;
import dev.hack.logs.stream.LogEventSink;
import dev.hack.logs.stream.NdjsonEventSink;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "logs",
    description = "Show project logs from docker compose or Loki.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LogsCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(LogsCommand.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final LogsEnvironment environment;
    private final Function<LogsEnvironment, LogsRunner> runners;
    private final PrintStream out;
    private final PrintStream err;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "SERVICE",
        description = "Only show logs for this service."
    )
    private String service;

    @CommandLine.Option(names = "--json", description = "Emit NDJSON stream events.")
    private boolean json;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print entries (time, level, service, fields).")
    private boolean pretty;

    @CommandLine.Option(names = "--loki", description = "Force the Loki backend.")
    private boolean loki;

    @CommandLine.Option(names = "--compose", description = "Force the docker compose backend.")
    private boolean compose;

    @CommandLine.Option(
        names = "--follow",
        negatable = true,
        defaultValue = "true",
        fallbackValue = "true",
        description = "Keep streaming new entries (--no-follow prints a snapshot and exits)."
    )
    private boolean follow = true;

    @CommandLine.Option(names = "--tail", description = "Number of recent entries to show.")
    private int tail = LogsConfiguration.DEFAULT_TAIL;

    @CommandLine.Option(names = "--since", description = "Start time (RFC3339, now, or a duration like 15m, 2h, 1d).")
    private String since;

    @CommandLine.Option(names = "--until", description = "End time (RFC3339, now, or a duration); snapshot only.")
    private String until;

    @CommandLine.Option(names = "--services", paramLabel = "CSV", description = "Comma separated services (Loki).")
    private String services;

    @CommandLine.Option(names = "--query", paramLabel = "LOGQL", description = "Raw LogQL query (Loki).")
    private String query;

    @CommandLine.Option(names = "--profile", paramLabel = "CSV", description = "Comma separated compose profiles.")
    private String profiles;

    @CommandLine.Option(names = "--branch", description = "Branch instance (compose project <name>--<branch>).")
    private String branch;

    @CommandLine.Option(names = "--path", description = "Directory inside the project (default: current directory).")
    private Path path;

    @CommandLine.Option(names = "--project", description = "Project name to use instead of the detected one.")
    private String project;

    @CommandLine.Option(
        names = "--collect",
        description = "Collect a bounded batch of events and print them as one JSON document."
    )
    private boolean collect;

    @CommandLine.Option(names = "--max-events", description = "With --collect: stop after this many log events.")
    private int maxEvents = LogTailCollector.DEFAULT_MAX_EVENTS;

    @CommandLine.Option(names = "--max-duration", description = "With --collect: stop after this long (e.g. 5s, 2m).")
    private String maxDuration = "5s";

    LogsCommand() {
        this(LogsEnvironment.fromSystem(), LogsRunner::new, System.out, System.err);
    }

    LogsCommand(
        LogsEnvironment environment,
        Function<LogsEnvironment, LogsRunner> runners,
        PrintStream out,
        PrintStream err
    ) {
        this.environment = environment;
        this.runners = runners;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        boolean lokiOnly = loki || services != null || query != null || since != null || until != null;
        if (compose && lokiOnly) {
            return usageError("Cannot combine --compose with --loki/--services/--query/--since/--until.");
        }
        if (json && pretty) {
            return usageError("Cannot combine --json with --pretty.");
        }
        if (tail < 0) {
            return usageError("--tail must not be negative.");
        }
        TimeRange range;
        List<String> serviceList;
        List<String> profileList;
        try {
            range = TimeRange.parse(since, until, Instant.now());
            serviceList = services == null ? null : CsvLists.parse(services);
            profileList = CsvLists.parse(profiles);
        } catch (IllegalArgumentException ex) {
            return usageError(ex.getMessage());
        }
        if (follow && range.end().isPresent()) {
            return usageError("Cannot combine --until with --follow.");
        }

        Path start = path != null ? path : Path.of("");
        ProjectContext context = ProjectContext.find(start)
            .orElseThrow(() -> new IllegalStateException("No .hack/ (or legacy .dev/) found. Run: hack init"));
        ProjectConfig config = ProjectConfigLoader.load(context);
        config.parseError().ifPresent(error -> log.warn(
            "Failed to parse {}: {}", config.configPath().orElse(context.configFile()), error
        ));
        var branchSlug = ComposeProjectNames.resolveBranchSlug(branch);
        String baseName = project != null && !project.isBlank()
            ? project.trim()
            : ComposeProjectNames.resolve(context, config);

        LogsConfiguration configuration = LogsConfiguration.builder()
            .composeFile(context.composeFile())
            .projectName(ComposeProjectNames.withBranch(baseName, branchSlug))
            .branch(branchSlug)
            .profiles(profileList)
            .service(service)
            .services(serviceList)
            .query(query)
            .follow(follow)
            .tail(tail)
            .since(since)
            .until(until)
            .timeRange(range)
            .forceCompose(compose)
            .forceLoki(loki)
            .followBackend(config.followBackendOrDefault())
            .snapshotBackend(config.snapshotBackendOrDefault())
            .build();

        LogsRunner runner = runners.apply(environment);
        if (collect) {
            return collect(runner, configuration);
        }
        return stream(runner, configuration);
    }

    private int stream(LogsRunner runner, LogsConfiguration configuration) {
        LogSession session = runner.open(configuration, sink(), err);
        Thread hook = new Thread(() -> {
            session.stop(null);
            try {
                session.awaitFinished(SHUTDOWN_GRACE);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "hack-logs-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return session.run().exitCode();
        } finally {
            removeHook(hook);
        }
    }

    private int collect(LogsRunner runner, LogsConfiguration configuration) {
        Duration limit = DurationParser.parse(maxDuration)
            .filter(value -> !value.isZero())
            .orElseThrow(() -> new CommandLine.ParameterException(
                spec.commandLine(), "Invalid --max-duration: " + maxDuration
            ));
        if (maxEvents <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-events must be positive.");
        }
        var collection = runner.collect(configuration, new LogTailCollector(maxEvents, limit));
        try {
            out.println(JSON_WRITER.writeValueAsString(collection.toSerializableMap()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize collected events: " + ex.getMessage(), ex);
        }
        return collection.result().exitCode();
    }

    private LogEventSink sink() {
        if (json) {
            return new NdjsonEventSink(out);
        }
        boolean color = Ansi.enabled(System.console() != null, System.getenv());
        return new TextEventSink(pretty ? OutputFormat.PRETTY : OutputFormat.PLAIN, color, out, err);
    }

    private int usageError(String message) {
        err.println(message);
        return 1;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            log.debug("JVM is shutting down; shutdown hook stays registered");
        }
    }
}
