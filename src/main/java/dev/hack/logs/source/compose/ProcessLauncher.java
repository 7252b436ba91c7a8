package dev.hack.logs.source.compose;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts the log subprocess; replaced in tests by a launcher that replays canned output.
 */
@FunctionalInterface
public interface ProcessLauncher {
    Process launch(List<String> command, Path workingDirectory) throws IOException;

    /**
     * Launches through {@link ProcessBuilder} with stdin closed immediately.
     */
    static ProcessLauncher system() {
        return (command, workingDirectory) -> {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            Process process = builder.start();
            process.getOutputStream().close();
            return process;
        };
    }
}
