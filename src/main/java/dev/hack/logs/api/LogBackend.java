package dev.hack.logs.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Where log entries come from: the compose subprocess or the Loki API.
 */
public enum LogBackend {
    COMPOSE,
    LOKI;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LogBackend> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "compose" -> Optional.of(COMPOSE);
            case "loki" -> Optional.of(LOKI);
            default -> Optional.empty();
        };
    }
}
