package dev.hack.logs.api;

/**
 * How {@code hack logs} renders a stream on stdout.
 */
public enum OutputFormat {
    PLAIN,
    PRETTY,
    JSON
}
