package dev.hack.logs.project;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.hack.logs.api.LogBackend;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectConfigLoaderTest {
    @TempDir
    Path root;

    private ProjectContext context() throws Exception {
        Path dir = Files.createDirectories(root.resolve(".hack"));
        Files.writeString(dir.resolve("docker-compose.yml"), "services: {}\n");
        return new ProjectContext(root, dir, dir.resolve("docker-compose.yml"));
    }

    @Test
    void readsJsonConfig() throws Exception {
        var context = context();
        Files.writeString(context.configFile(),
            "{\"name\":\"shop\",\"logs\":{\"follow_backend\":\"loki\",\"snapshot_backend\":\"Compose\"}}");

        var config = ProjectConfigLoader.load(context);

        assertEquals(Optional.of("shop"), config.name());
        assertEquals(LogBackend.LOKI, config.followBackendOrDefault());
        assertEquals(LogBackend.COMPOSE, config.snapshotBackendOrDefault());
        assertEquals(Optional.of(context.configFile()), config.configPath());
    }

    @Test
    void jsonWinsOverToml() throws Exception {
        var context = context();
        Files.writeString(context.configFile(), "{\"name\":\"from-json\"}");
        Files.writeString(context.legacyConfigFile(), "name = \"from-toml\"\n");

        assertEquals(Optional.of("from-json"), ProjectConfigLoader.load(context).name());
    }

    @Test
    void readsLegacyToml() throws Exception {
        var context = context();
        Files.writeString(context.legacyConfigFile(), "name = \"shop\"\n\n[logs]\nfollow_backend = \"loki\"\n");

        var config = ProjectConfigLoader.load(context);

        assertEquals(Optional.of("shop"), config.name());
        assertEquals(LogBackend.LOKI, config.followBackendOrDefault());
        assertEquals(LogBackend.LOKI, config.snapshotBackendOrDefault());
    }

    @Test
    void unknownBackendsFallBackToDefaults() {
        var config = ProjectConfigLoader.parseJson("{\"logs\":{\"follow_backend\":\"syslog\",\"snapshot_backend\":3}}", Path.of("x"));

        assertEquals(LogBackend.COMPOSE, config.followBackendOrDefault());
        assertEquals(LogBackend.LOKI, config.snapshotBackendOrDefault());
    }

    @Test
    void parseErrorsAreKept() {
        var json = ProjectConfigLoader.parseJson("{\"name\":", Path.of("hack.config.json"));
        var toml = ProjectConfigLoader.parseToml("name = ", Path.of("hack.toml"));

        assertTrue(json.parseError().isPresent());
        assertTrue(toml.parseError().isPresent());
        assertEquals(Optional.of(Path.of("hack.toml")), toml.configPath());
        assertTrue(json.name().isEmpty());
    }

    @Test
    void missingFilesGiveEmptyConfig() throws Exception {
        assertSame(ProjectConfig.EMPTY, ProjectConfigLoader.load(context()));
    }
}
