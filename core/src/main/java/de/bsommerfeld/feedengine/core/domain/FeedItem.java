package de.bsommerfeld.feedengine.core.domain;

/**
 * A persisted feed entry. Items are written once during ingestion and never
 * updated; they disappear only when their subscription is deleted.
 *
 * @param id             database row id
 * @param subscriptionId owning subscription
 * @param sourceType     source type of the owning subscription
 * @param title          entry title
 * @param url            entry URL, never empty for stored items
 * @param content        plain text with markup removed
 * @param published      publication timestamp as reported by the source
 * @param author         author or submitter name, may be empty
 * @param metadata       JSON object text with source-specific extras
 * @param fetchedAt      ISO-8601 UTC time the item was stored
 */
public record FeedItem(
        long id,
        long subscriptionId,
        SourceType sourceType,
        String title,
        String url,
        String content,
        String published,
        String author,
        String metadata,
        String fetchedAt) {
}
