package dev.hack.logs.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.hack.logs.api.LogBackend;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads the project config, preferring JSON and falling back to the legacy TOML file.
 */
public final class ProjectConfigLoader {
    private static final ObjectMapper JSON = new ObjectMapper();

    private ProjectConfigLoader() {}

    public static ProjectConfig load(ProjectContext context) {
        Path jsonPath = context.configFile();
        if (Files.isRegularFile(jsonPath)) {
            return parseJson(read(jsonPath), jsonPath);
        }
        Path tomlPath = context.legacyConfigFile();
        if (Files.isRegularFile(tomlPath)) {
            return parseToml(read(tomlPath), tomlPath);
        }
        return ProjectConfig.EMPTY;
    }

    static ProjectConfig parseJson(String text, Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(text);
        } catch (JsonProcessingException ex) {
            return ProjectConfig.failed(path, ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return withPath(ProjectConfig.EMPTY, path);
        }
        JsonNode logs = root.path("logs");
        return new ProjectConfig(
            text(root.get("name")),
            text(logs.get("follow_backend")).flatMap(LogBackend::parse),
            text(logs.get("snapshot_backend")).flatMap(LogBackend::parse),
            Optional.of(path),
            Optional.empty()
        );
    }

    static ProjectConfig parseToml(String text, Path path) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String message = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            return ProjectConfig.failed(path, message);
        }
        TomlTable logs = result.isTable("logs") ? result.getTable("logs") : null;
        return new ProjectConfig(
            tomlString(result, "name"),
            logs == null ? Optional.empty() : tomlString(logs, "follow_backend").flatMap(LogBackend::parse),
            logs == null ? Optional.empty() : tomlString(logs, "snapshot_backend").flatMap(LogBackend::parse),
            Optional.of(path),
            Optional.empty()
        );
    }

    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
    }

    private static ProjectConfig withPath(ProjectConfig config, Path path) {
        return new ProjectConfig(config.name(), config.followBackend(), config.snapshotBackend(), Optional.of(path), Optional.empty());
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    private static Optional<String> tomlString(TomlTable table, String key) {
        if (!table.isString(key)) {
            return Optional.empty();
        }
        String value = table.getString(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
