package dev.hack.logs.source.compose;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ComposeLogCommandTest {
    @Test
    void buildsFullCommandLine() {
        var command = new ComposeLogCommand(
            Path.of("/repo/.hack/docker-compose.yml"),
            "shop--feature",
            List.of("db", "workers"),
            true,
            50,
            "api"
        );

        assertEquals(
            List.of(
                "docker", "compose", "-p", "shop--feature", "-f", "/repo/.hack/docker-compose.yml",
                "--profile", "db", "--profile", "workers",
                "logs", "-f", "--tail", "50", "--timestamps", "--no-color", "api"
            ),
            command.toArgs()
        );
        assertEquals(Path.of("/repo/.hack"), command.workingDirectory());
    }

    @Test
    void omitsOptionalParts() {
        var command = new ComposeLogCommand(Path.of("/repo/.hack/docker-compose.yml"), null, null, false, 200, null);

        assertEquals(
            List.of("docker", "compose", "-f", "/repo/.hack/docker-compose.yml", "logs", "--tail", "200", "--timestamps", "--no-color"),
            command.toArgs()
        );
    }
}
