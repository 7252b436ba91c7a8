package dev.hack.logs.api;

import dev.hack.logs.source.loki.LokiClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Process-level settings read once from the environment and passed to {@link LogsRunner}.
 */
public record LogsEnvironment(String lokiUrl, Duration readyTimeout) {
    public static final String LOKI_URL = "HACK_LOKI_URL";
    public static final String READY_TIMEOUT_MS = "HACK_LOKI_READY_TIMEOUT_MS";
    public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofMillis(800);

    public LogsEnvironment {
        Objects.requireNonNull(lokiUrl, "lokiUrl");
        Objects.requireNonNull(readyTimeout, "readyTimeout");
    }

    public static LogsEnvironment fromSystem() {
        return fromEnvironment(System.getenv());
    }

    public static LogsEnvironment fromEnvironment(Map<String, String> env) {
        String url = env.getOrDefault(LOKI_URL, LokiClient.DEFAULT_BASE_URL).trim();
        return new LogsEnvironment(url.isEmpty() ? LokiClient.DEFAULT_BASE_URL : url, readyTimeout(env.get(READY_TIMEOUT_MS)));
    }

    static Duration readyTimeout(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_READY_TIMEOUT;
        }
        try {
            long millis = Long.parseLong(raw.trim());
            return millis > 0 ? Duration.ofMillis(millis) : DEFAULT_READY_TIMEOUT;
        } catch (NumberFormatException ex) {
            return DEFAULT_READY_TIMEOUT;
        }
    }
}
