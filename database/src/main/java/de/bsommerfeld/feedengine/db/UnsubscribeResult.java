package de.bsommerfeld.feedengine.db;

import de.bsommerfeld.feedengine.core.domain.Subscription;

import java.util.Optional;

/**
 * Outcome of an unsubscribe call. {@link #removed()} is empty when no
 * subscription matched.
 *
 * @param removedItems number of feed items deleted along with the subscription
 */
public record UnsubscribeResult(Optional<Subscription> removed, int removedItems) {

    public static UnsubscribeResult notFound() {
        return new UnsubscribeResult(Optional.empty(), 0);
    }

    public boolean found() {
        return removed.isPresent();
    }
}
