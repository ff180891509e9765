package de.bsommerfeld.feedengine.enrichment;

import de.bsommerfeld.feedengine.core.config.EnrichmentConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests filtering, caching and failure isolation of the auto-transcription
 * trigger. The transcriber is mocked; the cache is real and lives in a temp
 * directory.
 */
@ExtendWith(MockitoExtension.class)
class AutoTranscriberTest {

    private static final String VIDEO = "https://www.youtube.com/watch?v=aircAruvnKk";

    @TempDir
    Path cacheDir;

    @Mock
    private Transcriber transcriber;

    private EnrichmentConfig config;
    private TranscriptCache cache;
    private AutoTranscriber autoTranscriber;

    @BeforeEach
    void setUp() {
        config = new EnrichmentConfig();
        cache = new TranscriptCache(cacheDir);
        autoTranscriber = new AutoTranscriber(transcriber, cache, config);
    }

    @Test
    void enrich_newVideo_shouldTranscribeAndCache() throws Exception {
        when(transcriber.transcribe(VIDEO, "tiny")).thenReturn("hello world");

        List<EnrichmentOutcome> outcomes = autoTranscriber.enrich(List.of(video(VIDEO)));

        assertEquals(1, outcomes.size());
        assertEquals(EnrichmentOutcome.Status.TRANSCRIBED, outcomes.get(0).status());
        assertEquals("hello world", cache.get(VIDEO, "tiny").orElseThrow().transcript());
    }

    @Test
    void enrich_cachedVideo_shouldNotInvokeTranscriber() throws Exception {
        cache.put(VIDEO, "tiny", "already here");

        List<EnrichmentOutcome> outcomes = autoTranscriber.enrich(List.of(video(VIDEO)));

        assertTrue(outcomes.isEmpty());
        verifyNoInteractions(transcriber);
    }

    @Test
    void enrich_secondCall_shouldHitCache() throws Exception {
        when(transcriber.transcribe(VIDEO, "tiny")).thenReturn("once");

        autoTranscriber.enrich(List.of(video(VIDEO)));
        List<EnrichmentOutcome> second = autoTranscriber.enrich(List.of(video(VIDEO)));

        assertTrue(second.isEmpty());
        verify(transcriber, times(1)).transcribe(anyString(), anyString());
    }

    @Test
    void enrich_otherQualityTier_shouldBeSeparateCacheEntry() throws Exception {
        cache.put(VIDEO, "tiny", "tiny transcript");
        config.setQualityTier("base");
        when(transcriber.transcribe(VIDEO, "base")).thenReturn("base transcript");

        assertEquals(1, autoTranscriber.enrich(List.of(video(VIDEO))).size());
    }

    @Test
    void enrich_shouldIgnoreNonVideoUrlsAndEmptyInput() {
        assertTrue(autoTranscriber.enrich(List.of()).isEmpty());
        assertTrue(autoTranscriber.enrich(List.of(
                video("https://example.com/article"),
                video("https://www.youtube.com/channel/UCabc"))).isEmpty());
        verifyNoInteractions(transcriber);
    }

    @Test
    void enrich_emptyTranscript_shouldFailWithoutCaching() throws Exception {
        when(transcriber.transcribe(VIDEO, "tiny")).thenReturn(null, "  ", "finally");

        for (int attempt = 0; attempt < 2; attempt++) {
            List<EnrichmentOutcome> outcomes = autoTranscriber.enrich(List.of(video(VIDEO)));
            assertEquals(EnrichmentOutcome.Status.FAILED, outcomes.get(0).status());
            assertFalse(cache.contains(VIDEO, "tiny"));
        }

        List<EnrichmentOutcome> retried = autoTranscriber.enrich(List.of(video(VIDEO)));
        assertEquals(EnrichmentOutcome.Status.TRANSCRIBED, retried.get(0).status());
        assertEquals("finally", cache.get(VIDEO, "tiny").orElseThrow().transcript());
    }

    @Test
    void enrich_transcriberFailure_shouldBeReportedNotThrown() throws Exception {
        when(transcriber.transcribe(anyString(), anyString()))
                .thenThrow(new TranscriptionException("model missing"));

        List<EnrichmentOutcome> outcomes = assertDoesNotThrow(() -> autoTranscriber.enrich(List.of(video(VIDEO))));

        assertEquals(EnrichmentOutcome.Status.FAILED, outcomes.get(0).status());
        assertEquals("model missing", outcomes.get(0).detail());
        assertFalse(cache.contains(VIDEO, "tiny"));
    }

    @Test
    void enrich_shouldRespectPerCycleLimitAndDedupe() throws Exception {
        config.setMaxPerCycle(2);
        when(transcriber.transcribe(anyString(), anyString())).thenReturn("t");

        List<EnrichmentOutcome> outcomes = autoTranscriber.enrich(List.of(
                video("https://youtu.be/a1"),
                video("https://youtu.be/a1"),
                video("https://www.youtube.com/shorts/b2"),
                video("https://www.youtube.com/watch?v=c3")));

        assertEquals(2, outcomes.size());
        assertEquals("https://youtu.be/a1", outcomes.get(0).url());
        assertEquals("https://www.youtube.com/shorts/b2", outcomes.get(1).url());
    }

    @Test
    void enrich_disabled_shouldDoNothing() {
        config.setAutoTranscribe(false);
        assertTrue(autoTranscriber.enrich(List.of(video(VIDEO))).isEmpty());
        verifyNoInteractions(transcriber);
    }

    @Test
    void enrich_shouldFallBackToVideoUrlMetadata() throws Exception {
        when(transcriber.transcribe(VIDEO, "tiny")).thenReturn("meta");
        CanonicalItem item = new CanonicalItem("v", "https://example.com/redirect", "", "", "",
                Map.of("video_url", VIDEO));

        assertEquals(1, autoTranscriber.enrich(List.of(item)).size());
    }

    @Test
    void isVideoUrl_shouldRecognizeWatchShortAndShortsLinks() {
        assertTrue(AutoTranscriber.isVideoUrl("https://www.youtube.com/watch?v=abc"));
        assertTrue(AutoTranscriber.isVideoUrl("https://youtube.com/watch?feature=share&v=abc"));
        assertTrue(AutoTranscriber.isVideoUrl("https://youtu.be/abc"));
        assertTrue(AutoTranscriber.isVideoUrl("https://www.youtube.com/shorts/abc"));
        assertFalse(AutoTranscriber.isVideoUrl("https://vimeo.com/123"));
        assertFalse(AutoTranscriber.isVideoUrl(null));
    }

    private static CanonicalItem video(String url) {
        return new CanonicalItem("title", url, "", "", "");
    }
}
