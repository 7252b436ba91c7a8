package dev.hack.logs.source.compose;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.api.StdStream;
import dev.hack.logs.group.StructuredLogGrouper;
import dev.hack.logs.parse.ComposeLineParser;
import dev.hack.logs.source.LogSource;
import dev.hack.logs.source.LogSourceException;
import dev.hack.logs.source.SourceTermination;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams {@code docker compose logs} output. stdout and stderr are drained by separate tasks,
 * each with its own {@link StructuredLogGrouper}, so neither stream blocks the other.
 */
public final class ComposeLogSource implements LogSource {
    private static final Logger log = LoggerFactory.getLogger(ComposeLogSource.class);
    private static final Duration KILL_GRACE = Duration.ofSeconds(2);

    private final ComposeLogCommand command;
    private final String projectName;
    private final ProcessLauncher launcher;
    private final ExecutorService drains = Executors.newFixedThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "compose-logs-drain");
        thread.setDaemon(true);
        return thread;
    });

    private volatile Process process;
    private volatile boolean stopRequested;
    private Future<?> stdoutTask;
    private Future<?> stderrTask;

    public ComposeLogSource(ComposeLogCommand command, String projectName, ProcessLauncher launcher) {
        this.command = command;
        this.projectName = projectName;
        this.launcher = launcher;
    }

    @Override
    public LogBackend backend() {
        return LogBackend.COMPOSE;
    }

    @Override
    public void start(Consumer<LogEntry> entries) throws LogSourceException {
        var args = command.toArgs();
        log.debug("Running {}", String.join(" ", args));
        try {
            process = launcher.launch(args, command.workingDirectory());
        } catch (IOException ex) {
            drains.shutdown();
            throw new LogSourceException(
                "Failed to run docker compose logs: " + ex.getMessage(),
                "Tip: make sure Docker is installed and running.",
                ex
            );
        }
        stdoutTask = drains.submit(() -> drain(process.getInputStream(), StdStream.STDOUT, entries));
        stderrTask = drains.submit(() -> drain(process.getErrorStream(), StdStream.STDERR, entries));
        if (stopRequested) {
            // a stop that arrived before the launch found no process to destroy
            stop();
        }
    }

    @Override
    public SourceTermination awaitTermination() throws InterruptedException {
        if (process == null) {
            throw new IllegalStateException("Compose log source was not started");
        }
        try {
            int exitCode = process.waitFor();
            awaitDrain(stdoutTask);
            awaitDrain(stderrTask);
            log.debug("docker compose logs exited with {}", exitCode);
            if (stopRequested) {
                return SourceTermination.of("closed", 0);
            }
            return SourceTermination.of(exitCode == 0 ? "eof" : "exit:" + exitCode, exitCode);
        } finally {
            drains.shutdown();
        }
    }

    @Override
    public void stop() {
        stopRequested = true;
        Process running = process;
        if (running == null || !running.isAlive()) {
            return;
        }
        running.destroy();
        CompletableFuture.delayedExecutor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (running.isAlive()) {
                log.debug("docker compose logs ignored SIGTERM; killing");
                running.destroyForcibly();
            }
        });
    }

    private void drain(InputStream input, StdStream stream, Consumer<LogEntry> entries) {
        var grouper = new StructuredLogGrouper(group -> entries.accept(ComposeLineParser.parse(group, stream, projectName)));
        try (var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                grouper.handleLine(line);
            }
        } catch (IOException ex) {
            if (stopRequested) {
                log.debug("{} closed after stop: {}", stream.wireName(), ex.getMessage());
            } else {
                log.warn("Reading compose {} failed: {}", stream.wireName(), ex.getMessage());
            }
        } finally {
            grouper.flush();
        }
    }

    private static void awaitDrain(Future<?> task) throws InterruptedException {
        try {
            task.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Compose log drain failed", ex.getCause());
        }
    }
}
