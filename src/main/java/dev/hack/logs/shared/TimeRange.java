package dev.hack.logs.shared;

import java.time.Instant;
import java.util.Optional;

/**
 * Resolved {@code --since}/{@code --until} window, with both ends optional.
 */
public record TimeRange(Optional<Instant> start, Optional<Instant> end) {
    public static final TimeRange OPEN = new TimeRange(Optional.empty(), Optional.empty());

    /**
     * @throws IllegalArgumentException with a user-facing message when a bound is invalid or
     *     the window is inverted
     */
    public static TimeRange parse(String since, String until, Instant now) {
        String sinceRaw = since == null ? "" : since.trim();
        String untilRaw = until == null ? "" : until.trim();
        if (sinceRaw.isEmpty() && untilRaw.isEmpty()) {
            return OPEN;
        }
        Optional<Instant> start = Optional.empty();
        if (!sinceRaw.isEmpty()) {
            start = TimeInputParser.parse(sinceRaw, now);
            if (start.isEmpty()) {
                throw new IllegalArgumentException(invalid("--since", sinceRaw));
            }
        }
        Optional<Instant> end = Optional.empty();
        if (!untilRaw.isEmpty()) {
            end = TimeInputParser.parse(untilRaw, now);
            if (end.isEmpty()) {
                throw new IllegalArgumentException(invalid("--until", untilRaw));
            }
        }
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            throw new IllegalArgumentException("--since must be before --until.");
        }
        return new TimeRange(start, end);
    }

    private static String invalid(String option, String raw) {
        return "Invalid " + option + ": \"" + raw + "\" (expected RFC3339 or duration like 15m)";
    }
}
