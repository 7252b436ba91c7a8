package dev.hack.logs.project;

import dev.hack.logs.api.LogBackend;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Settings read from {@code hack.config.json} (or legacy {@code hack.toml}) that affect log
 * streaming. A config that failed to parse keeps its path and error so callers can warn.
 */
public record ProjectConfig(
    Optional<String> name,
    Optional<LogBackend> followBackend,
    Optional<LogBackend> snapshotBackend,
    Optional<Path> configPath,
    Optional<String> parseError
) {
    public static final ProjectConfig EMPTY = new ProjectConfig(
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty()
    );

    static ProjectConfig failed(Path path, String error) {
        return new ProjectConfig(Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(path), Optional.of(error));
    }

    public LogBackend followBackendOrDefault() {
        return followBackend.orElse(LogBackend.COMPOSE);
    }

    public LogBackend snapshotBackendOrDefault() {
        return snapshotBackend.orElse(LogBackend.LOKI);
    }
}
