package de.bsommerfeld.feedengine.db;

import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for subscriptions and feed items. Implementations must
 * be thread-safe for reads; writes arrive from the single writer thread of
 * {@link FeedRepository}.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: SQLite with an FTS5 full-text index</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode, no disk
 * I/O</li>
 * </ul>
 *
 * <p>
 * Switching between implementations is done at the Guice module level.
 * Callers interact through {@link FeedRepository}, which serializes all
 * mutations.
 */
public interface DatabaseService {

    /**
     * Creates a subscription unless one with the same type and identifier
     * exists. The existing row is returned untouched in that case.
     */
    SubscribeResult subscribe(SourceType sourceType, String identifier, String name, String feedUrl);

    /**
     * Deletes a subscription together with all of its items and their
     * full-text index entries, in one transaction.
     */
    UnsubscribeResult unsubscribe(SourceType sourceType, String identifier);

    /**
     * Inserts every item with a non-empty URL that is not yet stored for this
     * subscription. Items without a URL are discarded. The batch runs in a
     * single transaction.
     *
     * @return the items that were actually inserted, in input order; empty
     *         for an all-duplicate batch
     */
    List<CanonicalItem> storeItems(long subscriptionId, SourceType sourceType, List<CanonicalItem> items);

    /**
     * Full-text search over item title and content, best match first. A query
     * without searchable tokens returns an empty list.
     */
    List<FeedItem> search(String query, int limit);

    /**
     * Returns the most recently stored items, newest first.
     *
     * @param sourceType restrict to one source type, or {@code null} for all
     */
    List<FeedItem> getItems(SourceType sourceType, int limit);

    /** Returns all subscriptions ordered by type, then name. */
    List<Subscription> listSubscriptions();

    Optional<Subscription> getSubscription(SourceType sourceType, String identifier);

    int countItems(long subscriptionId);
}
