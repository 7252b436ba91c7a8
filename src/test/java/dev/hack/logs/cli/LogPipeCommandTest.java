package dev.hack.logs.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class LogPipeCommandTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private CommandLine commandLine(String input, boolean terminal) {
        var command = new LogPipeCommand(
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8),
            () -> terminal,
            false
        );
        return new CommandLine(command);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).strip().replace("\r\n", "\n");
    }

    @Test
    void prettyPrintsComposeLines() {
        String input = "api-1  | 2025-12-30T03:30:48.866Z {\"level\":\"warn\",\"msg\":\"slow\",\"ms\":900}\n"
            + "worker-2  | plain line\n";

        assertEquals(0, commandLine(input, false).execute());
        assertEquals("[03:30:48.866] [WARN] [api#1] slow ms=900\n[worker#2] plain line", stdout());
    }

    @Test
    void plainFormatIgnoresPipes() {
        assertEquals(0, commandLine("2025-12-30T03:30:48.866Z a | b\n", false).execute("--format", "plain"));
        assertEquals("[03:30:48.866] a | b", stdout());
    }

    @Test
    void stderrStreamForcesErrorLevel() {
        assertEquals(0, commandLine("{\"level\":\"info\",\"msg\":\"x\"}\n", false).execute("--stream", "stderr"));
        assertEquals("[ERROR] x", err.toString(StandardCharsets.UTF_8).strip());
        assertEquals("", stdout());
    }

    @Test
    void refusesInteractiveStdin() {
        assertEquals(1, commandLine("", true).execute());
        assertEquals("No stdin detected. Pipe logs into this command.", err.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void rejectsUnknownFormat() {
        var errors = new StringWriter();
        var cli = commandLine("", false);
        cli.setErr(new PrintWriter(errors));

        assertEquals(2, cli.execute("--format", "xml"));
        assertTrue(errors.toString().contains("Invalid --format: xml"));
    }
}
