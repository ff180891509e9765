package de.bsommerfeld.feedengine.core.error;

/**
 * Thrown when a payload is neither RSS nor Atom, or is not well-formed XML
 * or JSON at all.
 */
public class MalformedFeedException extends FeedException {

    public MalformedFeedException(String message) {
        super(message);
    }

    public MalformedFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
