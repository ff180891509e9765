package de.bsommerfeld.feedengine.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import de.bsommerfeld.feedengine.core.error.InvalidSourceTypeException;
import de.bsommerfeld.feedengine.core.event.ApplicationEventBus;
import de.bsommerfeld.feedengine.core.event.FeedEvents.SubscribedEvent;
import de.bsommerfeld.feedengine.core.event.FeedEvents.UnsubscribedEvent;
import de.bsommerfeld.feedengine.db.FeedRepository;
import de.bsommerfeld.feedengine.db.SubscribeResult;
import de.bsommerfeld.feedengine.db.UnsubscribeResult;
import de.bsommerfeld.feedengine.enrichment.EnrichmentOutcome;
import de.bsommerfeld.feedengine.sources.SourceAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Text-returning front door of the engine, meant for a CLI or a tool-calling
 * agent. Every operation returns a human-readable message and never throws:
 * invalid input yields an explanatory message, any other failure
 * {@code "Error: <message>"}.
 */
@Singleton
public class FeedService {

    private static final Logger LOG = LoggerFactory.getLogger(FeedService.class);

    static final int DEFAULT_ITEM_LIMIT = 20;
    private static final int SNIPPET_LENGTH = 200;

    private final FeedRepository repository;
    private final IngestionOrchestrator orchestrator;
    private final ApplicationEventBus eventBus;

    @Inject
    public FeedService(FeedRepository repository, IngestionOrchestrator orchestrator, ApplicationEventBus eventBus) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Subscriptions
    // =====================================================================

    public String subscribe(String type, String identifier) {
        return guarded(() -> {
            SourceType sourceType = SourceType.fromName(type);
            String id = SourceAdapters.normalizeIdentifier(sourceType, identifier);
            String name = SourceAdapters.displayName(sourceType, id);
            String feedUrl = SourceAdapters.resolveFeedUrl(sourceType, id);

            SubscribeResult result = repository.subscribe(sourceType, id, name, feedUrl);
            Subscription sub = result.subscription();
            if (!result.created())
                return "Already subscribed to " + sub.name() + " (" + label(sub.sourceType()) + ").";

            LOG.info("Subscribed to {}:{}", sourceType, id);
            eventBus.post(new SubscribedEvent(sourceType, id, sub.name()));
            return "Subscribed to " + sub.name() + " (" + label(sourceType) + ").\n"
                    + "Feed: " + sub.feedUrl() + "\n"
                    + "New items will be fetched on the next feed check.";
        });
    }

    public String unsubscribe(String type, String identifier) {
        return guarded(() -> {
            SourceType sourceType = SourceType.fromName(type);
            String id = lenientIdentifier(sourceType, identifier);

            UnsubscribeResult result = repository.unsubscribe(sourceType, id);
            if (!result.found())
                return "No subscription found for " + sourceType.wireName() + ":" + id + ".";

            Subscription removed = result.removed().get();
            LOG.info("Unsubscribed from {}:{} ({} items removed)", sourceType, id, result.removedItems());
            eventBus.post(new UnsubscribedEvent(sourceType, id, result.removedItems()));
            return "Unsubscribed from " + removed.name() + " (" + label(sourceType) + "). Removed "
                    + result.removedItems() + " stored items.";
        });
    }

    public String listSubscriptions() {
        return guarded(() -> {
            List<Subscription> subs = repository.listSubscriptions();
            if (subs.isEmpty())
                return "No subscriptions.";

            StringBuilder sb = new StringBuilder("Subscriptions (").append(subs.size()).append("):");
            for (Subscription sub : subs) {
                sb.append("\n[").append(label(sub.sourceType())).append("] ").append(sub.name())
                        .append("  (").append(sub.identifier()).append(")");
            }
            return sb.toString();
        });
    }

    // =====================================================================
    // Checking
    // =====================================================================

    public String checkFeeds() {
        return guarded(() -> formatSummary(orchestrator.checkAll()));
    }

    static String formatSummary(CheckSummary summary) {
        StringBuilder sb = new StringBuilder("Feed Check Complete: checked ")
                .append(summary.subscriptionsChecked()).append(" subscriptions, ")
                .append(summary.newItems()).append(" new items");
        for (SourceResult result : summary.results()) {
            sb.append("\n  [").append(label(result.sourceType())).append("] ").append(result.name()).append(": ");
            if (result.failed())
                sb.append("failed (").append(result.error()).append(")");
            else
                sb.append(result.newItems()).append(" new");
        }
        Map<SourceType, Integer> byType = summary.newItemsByType();
        if (byType.size() > 1) {
            sb.append("\nBy type:");
            byType.forEach((type, count) -> sb.append(" ").append(type.wireName()).append("=").append(count));
        }
        for (EnrichmentOutcome outcome : summary.enrichment()) {
            if (outcome.status() == EnrichmentOutcome.Status.TRANSCRIBED)
                sb.append("\n  Transcribed ").append(outcome.url()).append(" (").append(outcome.detail()).append(")");
            else
                sb.append("\n  Transcription failed for ").append(outcome.url()).append(": ")
                        .append(outcome.detail());
        }
        return sb.toString();
    }

    // =====================================================================
    // Reading
    // =====================================================================

    /**
     * Most recent items, optionally filtered by type.
     *
     * @param type  source type name, or {@code null}/blank for all
     * @param limit maximum items, or {@code null} for the default of 20
     */
    public String getFeedItems(String type, Integer limit) {
        return guarded(() -> {
            SourceType sourceType = type == null || type.isBlank() ? null : SourceType.fromName(type);
            List<FeedItem> items = repository.getItems(sourceType, effectiveLimit(limit));
            if (items.isEmpty())
                return "No feed items.";
            return formatItems(items.size() + " items:", items);
        });
    }

    public String searchFeeds(String query, Integer limit) {
        return guarded(() -> {
            String q = query == null ? "" : query.trim();
            List<FeedItem> hits = repository.search(q, effectiveLimit(limit));
            if (hits.isEmpty())
                return "No results for '" + q + "'.";
            return formatItems(hits.size() + " results for '" + q + "':", hits);
        });
    }

    private static String formatItems(String header, List<FeedItem> items) {
        StringBuilder sb = new StringBuilder(header);
        for (FeedItem item : items) {
            sb.append("\n\n[").append(label(item.sourceType())).append("] ")
                    .append(item.title().isEmpty() ? "(untitled)" : item.title())
                    .append("\n  URL: ").append(item.url());
            if (!item.published().isEmpty())
                sb.append("\n  Published: ").append(item.published());
            if (!item.content().isEmpty())
                sb.append("\n  ").append(snippet(item.content()));
        }
        return sb.toString();
    }

    static String snippet(String content) {
        if (content.length() <= SNIPPET_LENGTH)
            return content;
        return content.substring(0, SNIPPET_LENGTH).stripTrailing() + "...";
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static String label(SourceType type) {
        return type.name();
    }

    private static int effectiveLimit(Integer limit) {
        return limit == null || limit <= 0 ? DEFAULT_ITEM_LIMIT : limit;
    }

    /**
     * Normalizes like subscribe does, but falls back to the trimmed input so
     * that unknown identifiers report "not found" instead of a validation
     * error.
     */
    private static String lenientIdentifier(SourceType type, String identifier) {
        try {
            return SourceAdapters.normalizeIdentifier(type, identifier);
        } catch (IllegalArgumentException e) {
            return identifier == null ? "" : identifier.trim();
        }
    }

    private String guarded(Supplier<String> operation) {
        try {
            return operation.get();
        } catch (InvalidSourceTypeException e) {
            return e.getMessage();
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected feed request: {}", e.getMessage());
            return "Error: " + e.getMessage();
        } catch (RuntimeException e) {
            LOG.error("Feed operation failed", e);
            return "Error: " + e.getMessage();
        }
    }
}
