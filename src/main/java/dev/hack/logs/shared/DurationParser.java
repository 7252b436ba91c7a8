package dev.hack.logs.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 500ms}, {@code 30s}, {@code 2h}, {@code 1w}).
 */
public final class DurationParser {
    private static final Pattern WITH_UNIT = Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d|w)$");

    private DurationParser() {}

    /**
     * Parses a duration where a bare number means milliseconds.
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return toMillis(trimmed, 1L);
        }
        return parseWithUnit(trimmed);
    }

    /**
     * Parses a strictly positive duration that carries an explicit unit, as used for relative
     * time inputs ({@code 15m} means fifteen minutes ago).
     */
    public static Optional<Duration> parseRelative(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return parseWithUnit(raw.trim().toLowerCase(Locale.ROOT))
            .filter(duration -> !duration.isZero());
    }

    private static Optional<Duration> parseWithUnit(String trimmed) {
        Matcher matcher = WITH_UNIT.matcher(trimmed);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        long multiplier = switch (matcher.group(2)) {
            case "ms" -> 1L;
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            default -> 604_800_000L;
        };
        return toMillis(matcher.group(1), multiplier);
    }

    private static Optional<Duration> toMillis(String digits, long multiplier) {
        try {
            return Optional.of(Duration.ofMillis(Math.multiplyExact(Long.parseLong(digits), multiplier)));
        } catch (NumberFormatException | ArithmeticException ex) {
            return Optional.empty();
        }
    }
}
