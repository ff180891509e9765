package de.bsommerfeld.feedengine.enrichment;

/**
 * Result of one transcription attempt during a check cycle.
 *
 * @param detail transcript length for {@link Status#TRANSCRIBED}, the failure
 *               message for {@link Status#FAILED}
 */
public record EnrichmentOutcome(String url, Status status, String detail) {

    public enum Status {
        TRANSCRIBED,
        FAILED
    }

    public static EnrichmentOutcome transcribed(String url, int characters) {
        return new EnrichmentOutcome(url, Status.TRANSCRIBED, characters + " chars");
    }

    public static EnrichmentOutcome failed(String url, String reason) {
        return new EnrichmentOutcome(url, Status.FAILED, reason);
    }
}
