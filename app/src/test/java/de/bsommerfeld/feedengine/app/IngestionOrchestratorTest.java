package de.bsommerfeld.feedengine.app;

import de.bsommerfeld.feedengine.core.config.IngestionConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.error.FetchException;
import de.bsommerfeld.feedengine.core.event.ApplicationEventBus;
import de.bsommerfeld.feedengine.core.event.FeedEvents.FeedCheckCompletedEvent;
import de.bsommerfeld.feedengine.db.FeedRepository;
import de.bsommerfeld.feedengine.db.TestDatabaseService;
import de.bsommerfeld.feedengine.enrichment.AutoTranscriber;
import de.bsommerfeld.feedengine.enrichment.EnrichmentOutcome;
import de.bsommerfeld.feedengine.sources.SourceAdapters;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    private static final String GOOD_FEED = "https://example.com/good.xml";
    private static final String BROKEN_FEED = "https://example.com/broken.xml";
    private static final String CHANNEL_FEED = "https://www.youtube.com/feeds/videos.xml?channel_id=UCchannel";

    private static final String RSS = "<rss><channel>"
            + "<item><title>First</title><link>https://example.com/1</link><description>one</description></item>"
            + "<item><title>Second</title><link>https://example.com/2</link><description>two</description></item>"
            + "</channel></rss>";

    private static final String YOUTUBE = "<feed xmlns=\"http://www.w3.org/2005/Atom\""
            + " xmlns:yt=\"http://www.youtube.com/xml/schemas/2015\">"
            + "<entry><title>Video</title><yt:videoId>abc123</yt:videoId>"
            + "<link rel=\"alternate\" href=\"https://www.youtube.com/watch?v=abc123\"/>"
            + "<published>2024-01-01T00:00:00+00:00</published></entry>"
            + "</feed>";

    @Mock
    private AutoTranscriber autoTranscriber;
    @Mock
    private ApplicationEventBus eventBus;

    private final Map<String, String> responses = new HashMap<>();
    private FeedRepository repository;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        HttpFetcher fetcher = url -> {
            String body = responses.get(url);
            if (body == null)
                throw new FetchException("HTTP 503 from " + url, 503);
            return body.getBytes(StandardCharsets.UTF_8);
        };
        IngestionConfig config = new IngestionConfig();
        repository = new FeedRepository(new TestDatabaseService());
        orchestrator = new IngestionOrchestrator(repository, new SourceAdapters(fetcher, config), autoTranscriber,
                config, eventBus);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    @Test
    void checkAll_shouldReturnEmptySummaryWithoutSubscriptions() {
        CheckSummary summary = orchestrator.checkAll();

        assertEquals(0, summary.subscriptionsChecked());
        assertEquals(0, summary.newItems());
        verifyNoInteractions(autoTranscriber);
    }

    @Test
    void checkAll_shouldIsolateFailingSubscription() {
        responses.put(GOOD_FEED, RSS);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);
        repository.subscribe(SourceType.NEWS, BROKEN_FEED, "broken", BROKEN_FEED);

        CheckSummary summary = orchestrator.checkAll();

        assertEquals(2, summary.subscriptionsChecked());
        assertEquals(2, summary.newItems());
        assertEquals(1, summary.failedSubscriptions());

        SourceResult broken = summary.results().stream()
                .filter(r -> r.identifier().equals(BROKEN_FEED)).findFirst().orElseThrow();
        assertTrue(broken.failed());
        assertEquals(0, broken.newItems());
        assertTrue(broken.error().contains("503"));
    }

    @Test
    void checkAll_shouldCountOnlyNewItemsOnSecondRun() {
        responses.put(GOOD_FEED, RSS);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);

        assertEquals(2, orchestrator.checkAll().newItems());
        assertEquals(0, orchestrator.checkAll().newItems());
    }

    @Test
    void checkAll_shouldTreatUnparseablePayloadAsFailure() {
        responses.put(GOOD_FEED, "this is not xml");
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);

        CheckSummary summary = orchestrator.checkAll();

        assertEquals(1, summary.failedSubscriptions());
        assertEquals(0, summary.newItems());
    }

    @Test
    @SuppressWarnings("unchecked")
    void checkAll_shouldHandNewVideosToTranscriber() {
        responses.put(GOOD_FEED, RSS);
        responses.put(CHANNEL_FEED, YOUTUBE);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);
        repository.subscribe(SourceType.YOUTUBE, "UCchannel", "YouTube UCchannel", CHANNEL_FEED);
        when(autoTranscriber.enrich(anyList())).thenReturn(
                List.of(EnrichmentOutcome.transcribed("https://www.youtube.com/watch?v=abc123", 42)));

        CheckSummary summary = orchestrator.checkAll();

        ArgumentCaptor<List<CanonicalItem>> captor = ArgumentCaptor.forClass(List.class);
        verify(autoTranscriber).enrich(captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals("https://www.youtube.com/watch?v=abc123", captor.getValue().get(0).url());
        assertEquals(1, summary.enrichment().size());
    }

    @Test
    void checkAll_shouldNotCallTranscriberWithoutNewVideos() {
        responses.put(GOOD_FEED, RSS);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);

        orchestrator.checkAll();

        verifyNoInteractions(autoTranscriber);
    }

    @Test
    void checkAll_shouldPostCompletionEvent() {
        responses.put(GOOD_FEED, RSS);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);
        repository.subscribe(SourceType.NEWS, BROKEN_FEED, "broken", BROKEN_FEED);

        orchestrator.checkAll();

        verify(eventBus).post(new FeedCheckCompletedEvent(2, 2, 1));
    }

    @Test
    void checkOne_shouldReturnEmptyForUnknownSubscription() {
        assertTrue(orchestrator.checkOne(SourceType.NEWS, GOOD_FEED).isEmpty());
        verify(eventBus, never()).post(any());
    }

    @Test
    void checkOne_shouldCheckOnlyTheNamedSubscription() {
        responses.put(GOOD_FEED, RSS);
        repository.subscribe(SourceType.NEWS, GOOD_FEED, "good", GOOD_FEED);
        repository.subscribe(SourceType.NEWS, BROKEN_FEED, "broken", BROKEN_FEED);

        Optional<CheckSummary> summary = orchestrator.checkOne(SourceType.NEWS, GOOD_FEED);

        assertTrue(summary.isPresent());
        assertEquals(1, summary.get().subscriptionsChecked());
        assertEquals(0, summary.get().failedSubscriptions());
    }
}
