/**
 * Persistence layer for subscriptions and feed items. SQLite-backed in
 * production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [IngestionOrchestrator / FeedService]
 *        │
 *        ▼
 *   FeedRepository     ← single writer thread, reads pass straight through
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ subscriptions                                                     │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Surrogate key                                  │
 * │ source_type      │ Wire name, e.g. "reddit"                       │
 * │ identifier       │ Normalized identifier, e.g. "rust"             │
 * │ name             │ Display name                                   │
 * │ feed_url         │ Resolved feed URL                              │
 * │ created_at       │ ISO-8601, seconds precision                    │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   UNIQUE (source_type, identifier)
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ feed_items                                                        │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Insertion order, drives "most recent"          │
 * │ subscription_id  │ FK → subscriptions.id                          │
 * │ source_type      │ Copied from the subscription for filtering     │
 * │ title, url       │ url is the dedup key within a subscription     │
 * │ content          │ Plain text, HTML already stripped              │
 * │ published        │ Source timestamp as delivered                  │
 * │ author           │                                                │
 * │ metadata         │ JSON object of source-specific fields          │
 * │ fetched_at       │ ISO-8601, seconds precision                    │
 * └──────────────────┴────────────────────────────────────────────────┘
 *   UNIQUE (subscription_id, url)
 *
 *   feed_items_fts   FTS5 external-content index over (title, content),
 *                    kept in sync by AFTER INSERT / AFTER DELETE triggers.
 * </pre>
 *
 * Items are never updated. A re-fetched URL is ignored by
 * {@code INSERT OR IGNORE}, so the index only needs insert and delete
 * triggers.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql}, loaded via {@link SqlLoader}:
 * <ul>
 * <li>{@code insert-subscription.sql}: INSERT OR IGNORE subscription</li>
 * <li>{@code select-subscription.sql}: one subscription by type and identifier</li>
 * <li>{@code select-all-subscriptions.sql}: ordered by type, then name</li>
 * <li>{@code delete-subscription.sql}, {@code delete-items-for-subscription.sql}:
 * the unsubscribe cascade, run in one transaction</li>
 * <li>{@code insert-item.sql}: INSERT OR IGNORE item</li>
 * <li>{@code count-items-for-subscription.sql}</li>
 * <li>{@code select-recent-items.sql}, {@code select-recent-items-by-type.sql}</li>
 * <li>{@code search-items.sql}: FTS5 MATCH ranked by bm25</li>
 * </ul>
 */
package de.bsommerfeld.feedengine.db;
