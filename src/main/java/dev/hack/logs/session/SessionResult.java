package dev.hack.logs.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of one log session (usable by the CLI and embedding callers).
 */
public record SessionResult(
    Status status,
    String endReason,
    Optional<String> error,
    long entries,
    Instant startedAt,
    Instant finishedAt
) {
    public static SessionResult success(String endReason, long entries, Instant startedAt) {
        return new SessionResult(Status.SUCCESS, endReason, Optional.empty(), entries, startedAt, Instant.now());
    }

    public static SessionResult stopped(String endReason, long entries, Instant startedAt) {
        return new SessionResult(Status.STOPPED, endReason, Optional.empty(), entries, startedAt, Instant.now());
    }

    public static SessionResult failure(String endReason, String message, long entries, Instant startedAt) {
        return new SessionResult(Status.FAILURE, endReason, Optional.ofNullable(message), entries, startedAt, Instant.now());
    }

    public int exitCode() {
        return status.exitCode();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public enum Status {
        SUCCESS(0),
        STOPPED(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
