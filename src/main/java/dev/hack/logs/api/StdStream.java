package dev.hack.logs.api;

import java.util.Locale;

/**
 * Process output stream a compose line was read from.
 */
public enum StdStream {
    STDOUT,
    STDERR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
