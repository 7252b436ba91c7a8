package dev.hack.logs.stream;

import dev.hack.logs.api.LogBackend;
import java.util.List;
import java.util.Objects;

/**
 * Session facts mirrored onto the events of one log stream.
 */
public record LogStreamContext(
    LogBackend backend,
    String project,
    String branch,
    List<String> services,
    boolean follow,
    String since,
    String until
) {
    public LogStreamContext {
        Objects.requireNonNull(backend, "backend");
        services = services == null ? List.of() : List.copyOf(services);
    }
}
