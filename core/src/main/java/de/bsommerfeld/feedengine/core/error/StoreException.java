package de.bsommerfeld.feedengine.core.error;

/**
 * Unchecked wrapper for persistence failures. The store logs the underlying
 * {@link java.sql.SQLException} before wrapping it.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
