package de.bsommerfeld.feedengine.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import de.bsommerfeld.feedengine.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite.
 * Bound by Guice when the application starts with the {@code --test} flag.
 *
 * <p>
 * Search is a plain token match over title and content: an item matches when
 * every query token occurs as a word in it. Results are ordered by the number
 * of token occurrences, which roughly follows what BM25 ranks first on small
 * data sets.
 *
 * <p>
 * All methods synchronize on the instance; the data set is tiny and the
 * store is not meant for concurrent load.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    private final List<Subscription> subscriptions = new ArrayList<>();
    private final List<FeedItem> items = new ArrayList<>();
    private final ObjectMapper mapper = new ObjectMapper();
    private long nextSubscriptionId = 1;
    private long nextItemId = 1;

    public TestDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
    }

    @Override
    public synchronized SubscribeResult subscribe(SourceType sourceType, String identifier, String name,
            String feedUrl) {
        Optional<Subscription> existing = getSubscription(sourceType, identifier);
        if (existing.isPresent())
            return SubscribeResult.alreadySubscribed(existing.get());

        Subscription created = new Subscription(nextSubscriptionId++, sourceType, identifier, name, feedUrl, now());
        subscriptions.add(created);
        return SubscribeResult.created(created);
    }

    @Override
    public synchronized UnsubscribeResult unsubscribe(SourceType sourceType, String identifier) {
        Optional<Subscription> existing = getSubscription(sourceType, identifier);
        if (existing.isEmpty())
            return UnsubscribeResult.notFound();

        long id = existing.get().id();
        int before = items.size();
        items.removeIf(item -> item.subscriptionId() == id);
        subscriptions.remove(existing.get());
        return new UnsubscribeResult(existing, before - items.size());
    }

    @Override
    public synchronized List<CanonicalItem> storeItems(long subscriptionId, SourceType sourceType,
            List<CanonicalItem> batch) {
        List<CanonicalItem> inserted = new ArrayList<>();
        if (batch == null)
            return inserted;

        String fetchedAt = now();
        for (CanonicalItem item : batch) {
            if (!item.hasUrl() || containsUrl(subscriptionId, item.url()))
                continue;
            items.add(new FeedItem(nextItemId++, subscriptionId, sourceType, item.title(), item.url(),
                    item.content(), item.published(), item.author(), toJson(item), fetchedAt));
            inserted.add(item);
        }
        return inserted;
    }

    private boolean containsUrl(long subscriptionId, String url) {
        return items.stream().anyMatch(i -> i.subscriptionId() == subscriptionId && i.url().equals(url));
    }

    @Override
    public synchronized List<FeedItem> search(String query, int limit) {
        List<String> tokens = SearchQuery.tokens(query);
        if (tokens.isEmpty())
            return new ArrayList<>();

        List<ScoredItem> hits = new ArrayList<>();
        for (FeedItem item : items) {
            List<String> words = SearchQuery.tokens(item.title() + " " + item.content());
            if (!words.containsAll(tokens))
                continue;
            long score = words.stream().filter(tokens::contains).count();
            hits.add(new ScoredItem(item, score));
        }
        return hits.stream()
                .sorted(Comparator.comparingLong(ScoredItem::score).reversed())
                .limit(limit)
                .map(ScoredItem::item)
                .toList();
    }

    private record ScoredItem(FeedItem item, long score) {
    }

    @Override
    public synchronized List<FeedItem> getItems(SourceType sourceType, int limit) {
        return items.stream()
                .filter(i -> sourceType == null || i.sourceType() == sourceType)
                .sorted(Comparator.comparingLong(FeedItem::id).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<Subscription> listSubscriptions() {
        return subscriptions.stream()
                .sorted(Comparator.comparing((Subscription s) -> s.sourceType().wireName())
                        .thenComparing(s -> s.name().toLowerCase(Locale.ROOT)))
                .toList();
    }

    @Override
    public synchronized Optional<Subscription> getSubscription(SourceType sourceType, String identifier) {
        return subscriptions.stream()
                .filter(s -> s.sourceType() == sourceType && s.identifier().equals(identifier))
                .findFirst();
    }

    @Override
    public synchronized int countItems(long subscriptionId) {
        return (int) items.stream().filter(i -> i.subscriptionId() == subscriptionId).count();
    }

    private String toJson(CanonicalItem item) {
        try {
            return mapper.writeValueAsString(item.metadata());
        } catch (JsonProcessingException e) {
            throw new StoreException("Metadata is not serializable for " + item.url(), e);
        }
    }

    private static String now() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
