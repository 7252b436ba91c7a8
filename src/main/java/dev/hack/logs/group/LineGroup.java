package dev.hack.logs.group;

import java.util.List;
import java.util.Objects;

/**
 * Raw transport lines emitted together by the grouper; a passthrough line is a group of one.
 *
 * @param rawLines untouched multiplexed lines
 * @param jsonLines the same lines with the compose prefix and timestamp removed
 */
public record LineGroup(List<String> rawLines, List<String> jsonLines) {
    public LineGroup {
        Objects.requireNonNull(rawLines, "rawLines");
        Objects.requireNonNull(jsonLines, "jsonLines");
        rawLines = List.copyOf(rawLines);
        jsonLines = List.copyOf(jsonLines);
    }

    public static LineGroup single(String rawLine, String jsonLine) {
        return new LineGroup(List.of(rawLine), List.of(jsonLine));
    }

    public boolean isSingleLine() {
        return rawLines.size() == 1;
    }

    public String joinedRaw() {
        return String.join("\n", rawLines);
    }

    public String joinedJson() {
        return String.join("\n", jsonLines);
    }
}
