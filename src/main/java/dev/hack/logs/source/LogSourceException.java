package dev.hack.logs.source;

/**
 * A connectivity failure that ends a session before or while it streams.
 */
public class LogSourceException extends Exception {
    private final String hint;

    public LogSourceException(String message) {
        this(message, null, null);
    }

    public LogSourceException(String message, String hint, Throwable cause) {
        super(message, cause);
        this.hint = hint;
    }

    /**
     * Optional follow-up advice printed after the message on stderr.
     */
    public String hint() {
        return hint;
    }
}
