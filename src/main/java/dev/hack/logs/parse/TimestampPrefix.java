package dev.hack.logs.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A payload with its leading RFC3339 UTC timestamp (as written by {@code --timestamps}) split off.
 */
public record TimestampPrefix(String timestamp, String payload) {
    private static final Pattern LEADING_TIMESTAMP =
        Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?Z)(.*)$", Pattern.DOTALL);

    /**
     * Drops exactly one separator space after the timestamp; further indentation is payload.
     */
    public static TimestampPrefix split(String payload) {
        Matcher matcher = LEADING_TIMESTAMP.matcher(payload);
        if (!matcher.matches()) {
            return new TimestampPrefix(null, payload);
        }
        String rest = matcher.group(2);
        if (rest.startsWith(" ")) {
            rest = rest.substring(1);
        }
        return new TimestampPrefix(matcher.group(1), rest);
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }
}
