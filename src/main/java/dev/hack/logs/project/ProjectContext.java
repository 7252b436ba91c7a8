package dev.hack.logs.project;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locations of one hack project: the repository root and its {@code .hack} (or legacy
 * {@code .dev}) directory holding the compose file and config.
 */
public record ProjectContext(Path projectRoot, Path projectDir, Path composeFile) {
    public static final String PRIMARY_DIR = ".hack";
    public static final String LEGACY_DIR = ".dev";
    public static final String COMPOSE_FILENAME = "docker-compose.yml";
    public static final String CONFIG_FILENAME = "hack.config.json";
    public static final String LEGACY_CONFIG_FILENAME = "hack.toml";

    public ProjectContext {
        Objects.requireNonNull(projectRoot, "projectRoot");
        Objects.requireNonNull(projectDir, "projectDir");
        Objects.requireNonNull(composeFile, "composeFile");
    }

    /**
     * Walks up from {@code start} looking for {@code .hack/docker-compose.yml}, then for the
     * legacy {@code .dev/docker-compose.yml}.
     */
    public static Optional<ProjectContext> find(Path start) {
        Path from = start.toAbsolutePath().normalize();
        return findUp(from, PRIMARY_DIR).or(() -> findUp(from, LEGACY_DIR));
    }

    public Path configFile() {
        return projectDir.resolve(CONFIG_FILENAME);
    }

    public Path legacyConfigFile() {
        return projectDir.resolve(LEGACY_CONFIG_FILENAME);
    }

    private static Optional<ProjectContext> findUp(Path start, String dirName) {
        Path current = start;
        while (current != null) {
            Path projectDir = current.resolve(dirName);
            Path compose = projectDir.resolve(COMPOSE_FILENAME);
            if (Files.isRegularFile(compose)) {
                return Optional.of(new ProjectContext(current, projectDir, compose));
            }
            current = current.getParent();
        }
        return Optional.empty();
    }
}
