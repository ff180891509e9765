package de.bsommerfeld.feedengine.enrichment;

/**
 * Default binding when no transcription engine is installed. Every request
 * fails, so nothing is ever written to the transcript cache.
 */
public class UnavailableTranscriber implements Transcriber {

    @Override
    public String transcribe(String url, String qualityTier) throws TranscriptionException {
        throw new TranscriptionException("No transcription engine configured");
    }
}
