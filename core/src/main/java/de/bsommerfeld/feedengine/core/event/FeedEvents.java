package de.bsommerfeld.feedengine.core.event;

import de.bsommerfeld.feedengine.core.domain.SourceType;

/**
 * Events published on the {@link ApplicationEventBus} by the ingestion layer.
 */
public class FeedEvents {

    public record SubscribedEvent(SourceType sourceType, String identifier, String name) {
    }

    public record UnsubscribedEvent(SourceType sourceType, String identifier, int removedItems) {
    }

    /**
     * Fired once per completed check cycle, including cycles in which every
     * subscription failed.
     */
    public record FeedCheckCompletedEvent(int subscriptionsChecked, int newItems, int failedSubscriptions) {
    }
}
