package de.bsommerfeld.feedengine.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import de.bsommerfeld.feedengine.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single point of access to stored subscriptions and feed items.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li><strong>Writes</strong>: every mutation runs on one dedicated writer
 * thread. Concurrent fetch workers may call {@link #storeItems} at the same
 * time; their batches are applied one after another, never interleaved.
 * Callers block until their own write has committed.</li>
 * <li><strong>Reads</strong>: go straight to the {@link DatabaseService} on
 * the caller's thread.</li>
 * </ul>
 */
@Singleton
public class FeedRepository {

    private static final Logger LOG = LoggerFactory.getLogger(FeedRepository.class);

    private final DatabaseService databaseService;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "feed-store-writer");
        t.setDaemon(true);
        return t;
    });

    @Inject
    public FeedRepository(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    /**
     * Drains pending writes (up to 30s), then stops the writer thread.
     */
    public void shutdown() {
        LOG.info("Shutting down FeedRepository...");
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                writer.shutdownNow();
                LOG.warn("FeedRepository forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // -- Writes (serialized) --

    public SubscribeResult subscribe(SourceType sourceType, String identifier, String name, String feedUrl) {
        return write(() -> databaseService.subscribe(sourceType, identifier, name, feedUrl));
    }

    public UnsubscribeResult unsubscribe(SourceType sourceType, String identifier) {
        return write(() -> databaseService.unsubscribe(sourceType, identifier));
    }

    /**
     * Stores a batch and returns how many items were new.
     */
    public int storeItems(long subscriptionId, SourceType sourceType, List<CanonicalItem> items) {
        return storeNewItems(subscriptionId, sourceType, items).size();
    }

    /**
     * Stores a batch and returns the items that were new, in input order.
     */
    public List<CanonicalItem> storeNewItems(long subscriptionId, SourceType sourceType,
            List<CanonicalItem> items) {
        if (items == null || items.isEmpty())
            return List.of();
        return write(() -> databaseService.storeItems(subscriptionId, sourceType, items));
    }

    private <T> T write(Supplier<T> operation) {
        try {
            return CompletableFuture.supplyAsync(operation, writer).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re)
                throw re;
            throw new StoreException("Store write failed", e.getCause());
        }
    }

    // -- Reads --

    /** Ranked full-text hits; a non-positive {@code limit} yields no results. */
    public List<FeedItem> search(String query, int limit) {
        if (limit <= 0)
            return List.of();
        return databaseService.search(query, limit);
    }

    /** Newest items first; a non-positive {@code limit} yields no results. */
    public List<FeedItem> getItems(SourceType sourceType, int limit) {
        if (limit <= 0)
            return List.of();
        return databaseService.getItems(sourceType, limit);
    }

    public List<Subscription> listSubscriptions() {
        return databaseService.listSubscriptions();
    }

    public Optional<Subscription> getSubscription(SourceType sourceType, String identifier) {
        return databaseService.getSubscription(sourceType, identifier);
    }

    public int countItems(long subscriptionId) {
        return databaseService.countItems(subscriptionId);
    }
}
