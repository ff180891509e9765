package de.bsommerfeld.feedengine.core.error;

/**
 * Thrown when a caller names a source type outside the supported set.
 */
public class InvalidSourceTypeException extends IllegalArgumentException {

    private final String requested;

    public InvalidSourceTypeException(String requested, String validNames) {
        super("Invalid source type '" + requested + "'. Valid types: " + validNames);
        this.requested = requested;
    }

    public String getRequested() {
        return requested;
    }
}
