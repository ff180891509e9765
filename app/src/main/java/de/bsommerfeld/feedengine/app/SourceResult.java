package de.bsommerfeld.feedengine.app;

import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;

/**
 * Outcome of checking one subscription.
 *
 * @param newItems items actually inserted in this cycle
 * @param error    failure message, or {@code null} when the check succeeded
 */
public record SourceResult(SourceType sourceType, String identifier, String name, int newItems, String error) {

    public static SourceResult success(Subscription subscription, int newItems) {
        return new SourceResult(subscription.sourceType(), subscription.identifier(), subscription.name(),
                newItems, null);
    }

    public static SourceResult failure(Subscription subscription, String error) {
        return new SourceResult(subscription.sourceType(), subscription.identifier(), subscription.name(),
                0, error == null ? "unknown error" : error);
    }

    public boolean failed() {
        return error != null;
    }
}
