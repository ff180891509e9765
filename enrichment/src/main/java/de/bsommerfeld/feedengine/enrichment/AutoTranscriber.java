package de.bsommerfeld.feedengine.enrichment;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.config.EnrichmentConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Transcribes newly ingested videos exactly once per (url, quality tier).
 *
 * <h3>Per call</h3>
 * <ol>
 * <li>Keep items whose URL is a video page (watch, youtu.be or shorts link);
 * duplicates within the batch collapse to one.</li>
 * <li>Skip URLs already present in the {@link TranscriptCache}. A cache hit
 * never reaches the {@link Transcriber} and produces no outcome.</li>
 * <li>Transcribe at most {@code enrichment.max-per-cycle} of the rest and
 * cache each transcript.</li>
 * </ol>
 *
 * Transcriber failures are logged and reported as
 * {@link EnrichmentOutcome.Status#FAILED}; they never reach the caller.
 */
@Singleton
public class AutoTranscriber {

    private static final Logger LOG = LoggerFactory.getLogger(AutoTranscriber.class);

    private static final Pattern VIDEO_URL = Pattern.compile(
            "https?://(?:www\\.|m\\.)?(?:youtube\\.com/watch\\?(?:.*&)?v=|youtu\\.be/|youtube\\.com/shorts/)"
                    + "[A-Za-z0-9_-]+.*");

    private final Transcriber transcriber;
    private final TranscriptCache cache;
    private final EnrichmentConfig config;

    @Inject
    public AutoTranscriber(Transcriber transcriber, EnrichmentConfig config) {
        this(transcriber, new TranscriptCache(config.resolveCacheDir()), config);
    }

    public AutoTranscriber(Transcriber transcriber, TranscriptCache cache, EnrichmentConfig config) {
        this.transcriber = transcriber;
        this.cache = cache;
        this.config = config;
    }

    public static boolean isVideoUrl(String url) {
        return url != null && VIDEO_URL.matcher(url).matches();
    }

    /**
     * Transcribes the uncached videos among {@code items}.
     *
     * @return one outcome per attempted transcription; empty when nothing
     *         needed transcribing or auto-transcription is disabled
     */
    public synchronized List<EnrichmentOutcome> enrich(List<CanonicalItem> items) {
        List<EnrichmentOutcome> outcomes = new ArrayList<>();
        if (!config.isAutoTranscribe() || items == null || items.isEmpty())
            return outcomes;

        String tier = config.getQualityTier();
        Set<String> pending = new LinkedHashSet<>();
        for (CanonicalItem item : items) {
            String url = videoUrlOf(item);
            if (url != null && !cache.contains(url, tier))
                pending.add(url);
        }

        int budget = config.getMaxPerCycle();
        for (String url : pending) {
            if (outcomes.size() >= budget) {
                LOG.info("[ENRICH] Per-cycle limit of {} reached, {} videos deferred", budget,
                        pending.size() - outcomes.size());
                break;
            }
            outcomes.add(transcribe(url, tier));
        }
        return outcomes;
    }

    private EnrichmentOutcome transcribe(String url, String tier) {
        try {
            String transcript = transcriber.transcribe(url, tier);
            if (transcript == null || transcript.isBlank())
                throw new TranscriptionException("Empty transcript for " + url);
            cache.put(url, tier, transcript);
            LOG.info("[ENRICH] Transcribed {} ({} chars)", url, transcript.length());
            return EnrichmentOutcome.transcribed(url, transcript.length());
        } catch (TranscriptionException | IOException | RuntimeException e) {
            LOG.warn("[ENRICH] Transcription failed for {}: {}", url, e.getMessage());
            return EnrichmentOutcome.failed(url, String.valueOf(e.getMessage()));
        }
    }

    private static String videoUrlOf(CanonicalItem item) {
        if (isVideoUrl(item.url()))
            return item.url();
        Object fromMetadata = item.metadata().get("video_url");
        if (fromMetadata != null && isVideoUrl(fromMetadata.toString()))
            return fromMetadata.toString();
        return null;
    }
}
