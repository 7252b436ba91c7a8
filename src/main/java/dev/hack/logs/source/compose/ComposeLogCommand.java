package dev.hack.logs.source.compose;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arguments of one {@code docker compose logs} invocation.
 */
public record ComposeLogCommand(
    Path composeFile,
    String composeProject,
    List<String> profiles,
    boolean follow,
    int tail,
    String service
) {
    public ComposeLogCommand {
        Objects.requireNonNull(composeFile, "composeFile");
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
    }

    public List<String> toArgs() {
        List<String> args = new ArrayList<>(List.of("docker", "compose"));
        if (composeProject != null && !composeProject.isEmpty()) {
            args.add("-p");
            args.add(composeProject);
        }
        args.add("-f");
        args.add(composeFile.toString());
        for (String profile : profiles) {
            args.add("--profile");
            args.add(profile);
        }
        args.add("logs");
        if (follow) {
            args.add("-f");
        }
        args.add("--tail");
        args.add(String.valueOf(tail));
        args.add("--timestamps");
        args.add("--no-color");
        if (service != null && !service.isEmpty()) {
            args.add(service);
        }
        return args;
    }

    public Path workingDirectory() {
        Path parent = composeFile.toAbsolutePath().getParent();
        return parent != null ? parent : composeFile.toAbsolutePath();
    }
}
