package de.bsommerfeld.feedengine.core.domain;

/**
 * A stored subscription to one external source.
 *
 * @param id         database row id
 * @param sourceType which adapter handles this subscription
 * @param identifier source-specific key (subreddit, {@code owner/repo},
 *                   channel id, preset key or raw feed URL)
 * @param name       display label derived at subscribe time
 * @param feedUrl    resolved endpoint the adapter fetches
 * @param createdAt  ISO-8601 UTC creation timestamp
 */
public record Subscription(
        long id,
        SourceType sourceType,
        String identifier,
        String name,
        String feedUrl,
        String createdAt) {
}
