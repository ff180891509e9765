package de.bsommerfeld.feedengine.core.error;

/**
 * Thrown when a feed endpoint cannot be reached, times out or answers with a
 * non-success status.
 */
public class FetchException extends FeedException {

    private final int statusCode;

    public FetchException(String message) {
        this(message, -1);
    }

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed response, or {@code -1} for transport errors. */
    public int getStatusCode() {
        return statusCode;
    }
}
