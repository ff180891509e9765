package de.bsommerfeld.feedengine.core.error;

/**
 * Base type for failures while reading an external feed. Always confined to
 * the subscription being checked.
 */
public class FeedException extends Exception {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
