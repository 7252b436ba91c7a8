package dev.hack.logs.parse;

import dev.hack.logs.api.LogLevel;
import java.util.Map;

/**
 * Level, message and extra fields extracted from one log payload.
 */
public record ParsedPayload(String message, LogLevel level, Map<String, String> fields) {
    static ParsedPayload plain(String payload) {
        return new ParsedPayload(payload, null, Map.of());
    }
}
