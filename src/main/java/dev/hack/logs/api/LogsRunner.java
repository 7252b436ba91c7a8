package dev.hack.logs.api;

import dev.hack.logs.select.BackendSelector;
import dev.hack.logs.select.LogSelectors;
import dev.hack.logs.session.LogSession;
import dev.hack.logs.session.LogTailCollector;
import dev.hack.logs.session.SessionResult;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.compose.ComposeLogCommand;
import dev.hack.logs.source.compose.ComposeLogSource;
import dev.hack.logs.source.compose.ProcessLauncher;
import dev.hack.logs.source.loki.LokiClient;
import dev.hack.logs.source.loki.LokiSnapshotSource;
import dev.hack.logs.source.loki.LokiTailSource;
import dev.hack.logs.source.loki.LokiUnreachableSource;
import dev.hack.logs.stream.LogEventSink;
import dev.hack.logs.stream.LogStreamContext;
import dev.hack.logs.stream.LogStreamEvents;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for streaming a project's logs: picks the backend, builds the source and
 * hands it to a {@link LogSession}.
 */
public final class LogsRunner {
    private static final Logger log = LoggerFactory.getLogger(LogsRunner.class);

    private final LogsEnvironment environment;
    private final LokiClient loki;
    private final ProcessLauncher launcher;

    public LogsRunner(LogsEnvironment environment) {
        this(environment, new LokiClient(environment.lokiUrl()), ProcessLauncher.system());
    }

    public LogsRunner(LogsEnvironment environment, LokiClient loki, ProcessLauncher launcher) {
        this.environment = environment;
        this.loki = loki;
        this.launcher = launcher;
    }

    public SessionResult run(LogsConfiguration configuration, LogEventSink sink, PrintStream diagnostics) {
        return open(configuration, sink, diagnostics).run();
    }

    /**
     * Prepares a session without starting it so callers can wire {@link LogSession#stop} first.
     */
    public LogSession open(LogsConfiguration configuration, LogEventSink sink, PrintStream diagnostics) {
        var stream = prepare(configuration);
        return new LogSession(stream.source(), stream.events(), sink, diagnostics);
    }

    public LogTailCollector.TailCollection collect(LogsConfiguration configuration, LogTailCollector collector) {
        var stream = prepare(configuration);
        return collector.collect(stream.source(), stream.events());
    }

    public BackendChoice chooseBackend(LogsConfiguration configuration) {
        boolean explicit = configuration.wantsLokiExplicit();
        boolean shouldTry = BackendSelector.resolveShouldTryLoki(
            configuration.forceCompose(),
            explicit,
            configuration.follow(),
            configuration.followBackend(),
            configuration.snapshotBackend()
        );
        boolean reachable = shouldTry && loki.isReady(environment.readyTimeout());
        boolean useLoki = BackendSelector.resolveUseLoki(configuration.forceCompose(), explicit, shouldTry, reachable);
        log.debug(
            "Backend decision: tryLoki={} reachable={} useLoki={} (explicit={}, follow={})",
            shouldTry, reachable, useLoki, explicit, configuration.follow()
        );
        return new BackendChoice(useLoki ? LogBackend.LOKI : LogBackend.COMPOSE, reachable);
    }

    PreparedStream prepare(LogsConfiguration configuration) {
        var choice = chooseBackend(configuration);
        return choice.backend() == LogBackend.LOKI
            ? prepareLoki(configuration, choice.lokiReachable())
            : prepareCompose(configuration);
    }

    private PreparedStream prepareLoki(LogsConfiguration configuration, boolean reachable) {
        List<String> services = configuration.allServices();
        var context = context(configuration, LogBackend.LOKI, services);
        if (!reachable) {
            return new PreparedStream(new LokiUnreachableSource(loki.baseUrl()), new LogStreamEvents(context));
        }
        String query = configuration.query()
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .orElseGet(() -> LogSelectors.buildSelector(blankToNull(configuration.projectName()), services));
        log.debug("Loki query: {}", query);
        var range = configuration.timeRange();
        LogSource source = configuration.follow()
            ? new LokiTailSource(loki, query, configuration.tail(), range.start().orElse(null))
            : new LokiSnapshotSource(loki, query, configuration.tail(), range.start().orElse(null), range.end().orElse(null));
        return new PreparedStream(source, new LogStreamEvents(context));
    }

    private PreparedStream prepareCompose(LogsConfiguration configuration) {
        var service = configuration.service();
        var context = context(configuration, LogBackend.COMPOSE, service.map(List::of).orElse(List.of()));
        var command = new ComposeLogCommand(
            configuration.composeFile(),
            configuration.composeProject().orElse(null),
            configuration.profiles(),
            configuration.follow(),
            configuration.tail(),
            service.orElse(null)
        );
        var source = new ComposeLogSource(command, blankToNull(configuration.projectName()), launcher);
        return new PreparedStream(source, new LogStreamEvents(context));
    }

    private static LogStreamContext context(LogsConfiguration configuration, LogBackend backend, List<String> services) {
        return new LogStreamContext(
            backend,
            blankToNull(configuration.projectName()),
            configuration.branch().orElse(null),
            services,
            configuration.follow(),
            configuration.since().orElse(null),
            configuration.until().orElse(null)
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Selected backend plus whether the readiness probe succeeded (false when it never ran).
     */
    public record BackendChoice(LogBackend backend, boolean lokiReachable) {}

    record PreparedStream(LogSource source, LogStreamEvents events) {}
}
