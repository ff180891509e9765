package de.bsommerfeld.feedengine.enrichment;

/**
 * A transcript could not be produced for a URL.
 */
public class TranscriptionException extends Exception {

    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
