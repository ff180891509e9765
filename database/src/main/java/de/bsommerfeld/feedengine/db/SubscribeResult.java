package de.bsommerfeld.feedengine.db;

import de.bsommerfeld.feedengine.core.domain.Subscription;

/**
 * Outcome of a subscribe call. An existing subscription is reported with
 * {@code created == false} and is returned unchanged.
 */
public record SubscribeResult(boolean created, Subscription subscription) {

    public static SubscribeResult created(Subscription subscription) {
        return new SubscribeResult(true, subscription);
    }

    public static SubscribeResult alreadySubscribed(Subscription subscription) {
        return new SubscribeResult(false, subscription);
    }
}
