package de.bsommerfeld.feedengine.enrichment;

/**
 * Speech-to-text engine for video URLs. Implementations download and
 * transcribe; caching is done by {@link AutoTranscriber}.
 */
public interface Transcriber {

    /**
     * Produces the transcript of the video at {@code url}.
     *
     * @param qualityTier engine model size, e.g. {@code tiny} or {@code base}
     * @throws TranscriptionException if the video cannot be transcribed
     */
    String transcribe(String url, String qualityTier) throws TranscriptionException;
}
