package dev.hack.logs.source;

import java.util.Objects;
import java.util.Optional;

/**
 * How a source finished: the {@code end} event reason, the exit code the session should
 * report, and a failure message when the source broke down mid-stream.
 */
public record SourceTermination(String reason, int exitCode, Optional<String> error) {
    public SourceTermination {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(error, "error");
    }

    public static SourceTermination of(String reason, int exitCode) {
        return new SourceTermination(reason, exitCode, Optional.empty());
    }

    public static SourceTermination failed(String message) {
        return new SourceTermination("error", 1, Optional.of(message));
    }

    public boolean failed() {
        return error.isPresent();
    }
}
