package de.bsommerfeld.feedengine.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.config.IngestionConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import de.bsommerfeld.feedengine.core.error.FeedException;
import de.bsommerfeld.feedengine.core.event.ApplicationEventBus;
import de.bsommerfeld.feedengine.core.event.FeedEvents.FeedCheckCompletedEvent;
import de.bsommerfeld.feedengine.db.FeedRepository;
import de.bsommerfeld.feedengine.enrichment.AutoTranscriber;
import de.bsommerfeld.feedengine.enrichment.EnrichmentOutcome;
import de.bsommerfeld.feedengine.sources.SourceAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs check cycles: fetch every subscription, store what is new, and hand
 * new videos to the {@link AutoTranscriber}.
 *
 * <h3>Cycle</h3>
 * <pre>
 * listSubscriptions()
 *   └ fetch pool (ingestion.fetch-concurrency)
 *       └ SourceAdapters.check()  → FeedRepository.storeNewItems()  (single writer)
 *   └ AutoTranscriber.enrich(new youtube items)
 *   └ FeedCheckCompletedEvent
 * </pre>
 *
 * <h3>Failure isolation</h3>
 * Every subscription is checked inside its own try block. A timeout, HTTP
 * error, unparseable payload or store failure is logged and recorded as zero
 * new items with an error note; the other subscriptions are unaffected and
 * the cycle always returns a summary.
 */
@Singleton
public class IngestionOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final FeedRepository repository;
    private final SourceAdapters adapters;
    private final AutoTranscriber autoTranscriber;
    private final IngestionConfig config;
    private final ApplicationEventBus eventBus;

    @Inject
    public IngestionOrchestrator(FeedRepository repository, SourceAdapters adapters,
            AutoTranscriber autoTranscriber, IngestionConfig config, ApplicationEventBus eventBus) {
        this.repository = repository;
        this.adapters = adapters;
        this.autoTranscriber = autoTranscriber;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Checks every subscription once. */
    public CheckSummary checkAll() {
        return run(repository.listSubscriptions());
    }

    /**
     * Checks a single subscription.
     *
     * @return empty when no such subscription exists
     */
    public Optional<CheckSummary> checkOne(SourceType sourceType, String identifier) {
        return repository.getSubscription(sourceType, identifier).map(sub -> run(List.of(sub)));
    }

    private CheckSummary run(List<Subscription> subscriptions) {
        if (subscriptions.isEmpty()) {
            LOG.info("[INGEST] No subscriptions to check.");
            return CheckSummary.empty();
        }

        LOG.info("[INGEST] Checking {} subscriptions...", subscriptions.size());
        long start = System.currentTimeMillis();

        List<SourceResult> results = new ArrayList<>(subscriptions.size());
        List<CanonicalItem> newVideos = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(config.getFetchConcurrency(), subscriptions.size())));
        try {
            List<Future<CheckedSource>> futures = new ArrayList<>(subscriptions.size());
            for (Subscription sub : subscriptions)
                futures.add(pool.submit(() -> checkSubscription(sub)));

            for (int i = 0; i < futures.size(); i++) {
                CheckedSource checked = await(futures.get(i), subscriptions.get(i));
                results.add(checked.result());
                if (checked.result().sourceType() == SourceType.YOUTUBE)
                    newVideos.addAll(checked.inserted());
            }
        } finally {
            pool.shutdownNow();
        }

        List<EnrichmentOutcome> enrichment = newVideos.isEmpty() ? List.of() : autoTranscriber.enrich(newVideos);
        CheckSummary summary = new CheckSummary(results, enrichment);

        LOG.info("[INGEST] Cycle finished in {}ms: {} subscriptions, {} new items, {} failed",
                System.currentTimeMillis() - start, summary.subscriptionsChecked(), summary.newItems(),
                summary.failedSubscriptions());
        eventBus.post(new FeedCheckCompletedEvent(summary.subscriptionsChecked(), summary.newItems(),
                summary.failedSubscriptions()));
        return summary;
    }

    private CheckedSource checkSubscription(Subscription sub) {
        try {
            List<CanonicalItem> fetched = adapters.check(sub.sourceType(), sub.identifier(),
                    config.getDefaultLimit());
            List<CanonicalItem> inserted = repository.storeNewItems(sub.id(), sub.sourceType(), fetched);
            LOG.debug("[INGEST] {}:{} fetched {}, new {}", sub.sourceType(), sub.identifier(), fetched.size(),
                    inserted.size());
            return new CheckedSource(SourceResult.success(sub, inserted.size()), inserted);
        } catch (FeedException | RuntimeException e) {
            LOG.warn("[INGEST] {}:{} failed: {}", sub.sourceType(), sub.identifier(), e.getMessage());
            return new CheckedSource(SourceResult.failure(sub, e.getMessage()), List.of());
        }
    }

    private CheckedSource await(Future<CheckedSource> future, Subscription sub) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.error("[INGEST] Unexpected failure checking {}:{}", sub.sourceType(), sub.identifier(), e.getCause());
            return new CheckedSource(SourceResult.failure(sub, String.valueOf(e.getCause())), List.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CheckedSource(SourceResult.failure(sub, "interrupted"), List.of());
        }
    }

    private record CheckedSource(SourceResult result, List<CanonicalItem> inserted) {
    }
}
