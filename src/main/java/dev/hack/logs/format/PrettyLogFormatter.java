package dev.hack.logs.format;

import dev.hack.logs.api.LogBackend;
import dev.hack.logs.api.LogEntry;
import dev.hack.logs.api.LogLevel;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-readable rendering: {@code [HH:MM:SS.mmm] [LEVEL] [label] message key=value ...}.
 *
 * <p>The time tag appears only when the entry carries a timestamp, the level tag only when it
 * has a level, and compose entries without a container prefix print no label. Fields are
 * printed in key order.
 */
public final class PrettyLogFormatter {
    private static final Pattern CLOCK = Pattern.compile("T(\\d{2}:\\d{2}:\\d{2})(?:\\.(\\d+))?Z$");
    private static final Pattern INSTANCE = Pattern.compile("^(.+?)(#\\d+)$");

    private final boolean color;

    public PrettyLogFormatter(boolean color) {
        this.color = color;
    }

    public String format(LogEntry entry) {
        var line = new StringBuilder();
        entry.timestampOpt().ifPresent(ts -> line.append(bracket(clock(ts), Ansi.DIM)).append(' '));
        entry.levelOpt().ifPresent(level -> line.append(levelTag(level)).append(' '));
        var label = entry.source() == LogBackend.LOKI ? Optional.of(EntryLabels.of(entry)) : EntryLabels.find(entry);
        label.ifPresent(value -> line.append(labelTag(value)).append(' '));
        line.append(entry.message());
        Map<String, String> fields = entry.fields();
        if (fields != null) {
            // fields is a sorted map
            fields.forEach((key, value) -> line.append(' ')
                .append(color ? Ansi.color(key, Ansi.DIM) : key)
                .append('=')
                .append(value));
        }
        return line.toString();
    }

    static String clock(String iso) {
        Matcher matcher = CLOCK.matcher(iso);
        if (!matcher.find()) {
            return iso;
        }
        String fraction = matcher.group(2);
        if (fraction == null) {
            return matcher.group(1);
        }
        String millis = fraction.length() >= 3 ? fraction.substring(0, 3) : (fraction + "000").substring(0, 3);
        return matcher.group(1) + "." + millis;
    }

    private String levelTag(LogLevel level) {
        String label = level.name();
        if (!color) {
            return "[" + label + "]";
        }
        String code = switch (level) {
            case DEBUG -> Ansi.DIM;
            case INFO -> Ansi.CYAN;
            case WARN -> Ansi.YELLOW;
            case ERROR -> Ansi.RED;
        };
        return Ansi.color("[", Ansi.DIM) + Ansi.color(label, code) + Ansi.color("]", Ansi.DIM);
    }

    private String labelTag(String label) {
        if (!color) {
            return "[" + label + "]";
        }
        Matcher matcher = INSTANCE.matcher(label);
        String base = matcher.matches() ? matcher.group(1) : label;
        String suffix = matcher.matches() ? Ansi.color(matcher.group(2), Ansi.DIM) : "";
        return Ansi.color("[", Ansi.DIM) + Ansi.hashed(base) + suffix + Ansi.color("]", Ansi.DIM);
    }

    private String bracket(String text, String code) {
        if (!color) {
            return "[" + text + "]";
        }
        return Ansi.color("[", code) + Ansi.color(text, code) + Ansi.color("]", code);
    }
}
