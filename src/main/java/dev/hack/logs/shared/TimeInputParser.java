package dev.hack.logs.shared;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves {@code --since}/{@code --until} values: {@code now}, a duration before now, or an
 * RFC3339 instant.
 */
public final class TimeInputParser {
    private TimeInputParser() {}

    public static Optional<Instant> parse(String raw, Instant now) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if ("now".equals(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.of(now);
        }
        var relative = DurationParser.parseRelative(trimmed);
        if (relative.isPresent()) {
            return Optional.of(now.minus(relative.get()));
        }
        return parseAbsolute(trimmed);
    }

    private static Optional<Instant> parseAbsolute(String text) {
        try {
            if (text.indexOf('T') > 0 || text.indexOf('t') > 0) {
                return Optional.of(OffsetDateTime.parse(text.toUpperCase(Locale.ROOT)).toInstant());
            }
            return Optional.of(LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
