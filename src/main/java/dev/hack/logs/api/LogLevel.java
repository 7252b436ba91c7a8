package dev.hack.logs.api;

import java.util.Locale;

/**
 * Canonical log levels every source is normalized to.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a textual level name; unknown names fall back to {@link #INFO}.
     */
    public static LogLevel fromName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "debug" -> DEBUG;
            case "warn", "warning" -> WARN;
            case "error", "fatal", "panic" -> ERROR;
            default -> INFO;
        };
    }

    /**
     * Maps pino numeric levels (10 trace, 20 debug, 30 info, 40 warn, 50 error, 60 fatal).
     */
    public static LogLevel fromPino(double level) {
        if (level >= 50) {
            return ERROR;
        }
        if (level >= 40) {
            return WARN;
        }
        if (level >= 30) {
            return INFO;
        }
        return DEBUG;
    }
}
