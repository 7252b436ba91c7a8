package dev.hack.logs.project;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the docker compose project name used both for {@code -p} and as the log label prefix.
 */
public final class ComposeProjectNames {
    private static final Logger log = LoggerFactory.getLogger(ComposeProjectNames.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ComposeProjectNames() {}

    /**
     * Compose file {@code name:}, else config {@code name}, else the project directory slug.
     */
    public static String resolve(ProjectContext context, ProjectConfig config) {
        var fromCompose = readComposeName(context.composeFile());
        if (fromCompose.isPresent()) {
            return fromCompose.get();
        }
        String derived = sanitizeProjectSlug(
            context.projectRoot().getFileName() == null ? "" : context.projectRoot().getFileName().toString()
        );
        String configured = config.name().map(String::trim).orElse(derived);
        return configured.isEmpty() ? derived : configured;
    }

    /**
     * {@code <base>--<branch>} when a branch is given, the base name otherwise.
     */
    public static String withBranch(String baseName, Optional<String> branchSlug) {
        return branchSlug.map(branch -> baseName + "--" + branch).orElse(baseName);
    }

    public static Optional<String> readComposeName(Path composeFile) {
        if (!Files.isRegularFile(composeFile)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(composeFile.toFile());
        } catch (IOException ex) {
            log.debug("Ignoring unreadable compose file {}: {}", composeFile, ex.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode name = root.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(name.asText().trim());
    }

    public static String sanitizeProjectSlug(String input) {
        String slug = slug(input);
        return slug.isEmpty() ? "project" : slug;
    }

    public static String sanitizeBranchSlug(String input) {
        return slug(input);
    }

    /**
     * Empty input means no branch; input that sanitizes to nothing becomes {@code branch}.
     */
    public static Optional<String> resolveBranchSlug(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String slug = sanitizeBranchSlug(trimmed);
        return Optional.of(slug.isEmpty() ? "branch" : slug);
    }

    private static String slug(String input) {
        String lowered = input.trim().toLowerCase(Locale.ROOT)
            .replace('_', '-')
            .replace(' ', '-')
            .replace('/', '-');
        return lowered.replaceAll("[^a-z0-9-]", "")
            .replaceAll("-+", "-")
            .replaceAll("^-|-$", "");
    }
}
