package dev.hack.logs.shared;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * ISO-8601 and nanosecond timestamp helpers shared by the parsers and the event protocol.
 */
public final class Timestamps {
    private static final DateTimeFormatter ISO_MILLIS =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final BigInteger NANOS_PER_MILLI = BigInteger.valueOf(1_000_000L);

    private Timestamps() {}

    /**
     * Formats with a fixed millisecond fraction, e.g. {@code 2025-12-30T03:30:48.000Z}.
     */
    public static String formatIso(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    /**
     * Converts a decimal nanosecond epoch string to ISO-8601 with millisecond precision.
     */
    public static Optional<String> nanosToIso(String nanos) {
        if (nanos == null || nanos.isBlank()) {
            return Optional.empty();
        }
        try {
            long millis = new BigInteger(nanos.trim()).divide(NANOS_PER_MILLI).longValueExact();
            return Optional.of(formatIso(Instant.ofEpochMilli(millis)));
        } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
            return Optional.empty();
        }
    }

    public static String toNanos(Instant instant) {
        return BigInteger.valueOf(instant.toEpochMilli()).multiply(NANOS_PER_MILLI).toString();
    }
}
