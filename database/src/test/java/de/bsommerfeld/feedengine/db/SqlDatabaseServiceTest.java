package de.bsommerfeld.feedengine.db;

import de.bsommerfeld.feedengine.core.config.StoreConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlDatabaseService against a real temporary SQLite
 * database. Covers schema init, idempotent inserts, cascade delete with the
 * full-text index, and search.
 */
class SqlDatabaseServiceTest {

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(new StoreConfig(tempDir.resolve("data/feeds.db")));
    }

    // -- Schema --

    @Test
    void constructor_shouldCreateParentDirectoryAndFile() {
        assertTrue(Files.exists(tempDir.resolve("data/feeds.db")));
    }

    @Test
    void constructor_shouldBeSafeToRunTwiceOnSameFile() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(item("A", "http://x/1")));

        SqlDatabaseService reopened = new SqlDatabaseService(new StoreConfig(tempDir.resolve("data/feeds.db")));
        assertEquals(1, reopened.listSubscriptions().size());
        assertEquals(1, reopened.countItems(sub.id()));
    }

    // -- Subscriptions --

    @Test
    void subscribe_shouldCreateOnce() {
        SubscribeResult first = db.subscribe(SourceType.REDDIT, "rust", "r/rust", "https://www.reddit.com/r/rust/.rss");
        SubscribeResult second = db.subscribe(SourceType.REDDIT, "rust", "other", "https://other");

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.subscription().id(), second.subscription().id());
        assertEquals("r/rust", second.subscription().name());
        assertEquals(1, db.listSubscriptions().size());
    }

    @Test
    void subscribe_sameIdentifierDifferentType_shouldBeDistinct() {
        subscribe(SourceType.NEWS, "python");
        subscribe(SourceType.REDDIT, "python");

        assertEquals(2, db.listSubscriptions().size());
    }

    @Test
    void listSubscriptions_shouldOrderByTypeThenName() {
        db.subscribe(SourceType.REDDIT, "b", "beta", "u1");
        db.subscribe(SourceType.NEWS, "z", "Zeta", "u2");
        db.subscribe(SourceType.NEWS, "a", "alpha", "u3");

        List<Subscription> all = db.listSubscriptions();
        assertEquals(List.of("alpha", "Zeta", "beta"), all.stream().map(Subscription::name).toList());
    }

    @Test
    void unsubscribe_unknown_shouldReportNotFound() {
        UnsubscribeResult result = db.unsubscribe(SourceType.NEWS, "nope");
        assertFalse(result.found());
        assertEquals(0, result.removedItems());
    }

    @Test
    void unsubscribe_shouldRemoveItemsAndIndexEntries() throws SQLException {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        Subscription other = subscribe(SourceType.NEWS, "npr");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(
                item("Alpha story", "http://x/1"),
                item("Beta story", "http://x/2")));
        db.storeItems(other.id(), SourceType.NEWS, List.of(item("Gamma story", "http://y/1")));

        UnsubscribeResult result = db.unsubscribe(SourceType.NEWS, "bbc");

        assertTrue(result.found());
        assertEquals(2, result.removedItems());
        assertEquals(0, db.countItems(sub.id()));
        assertTrue(db.getSubscription(SourceType.NEWS, "bbc").isEmpty());
        assertEquals(1, indexedDocuments());
        assertTrue(db.search("alpha", 10).isEmpty());
        assertEquals(1, db.search("gamma", 10).size());
    }

    // -- Items --

    @Test
    void storeItems_shouldBeIdempotent() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        List<CanonicalItem> batch = List.of(item("A", "http://x/1"), item("B", "http://x/2"));

        assertEquals(2, db.storeItems(sub.id(), SourceType.NEWS, batch).size());
        assertEquals(0, db.storeItems(sub.id(), SourceType.NEWS, batch).size());
        assertEquals(2, db.countItems(sub.id()));
    }

    @Test
    void storeItems_shouldReturnOnlyNewItemsInOrder() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(item("B", "http://x/2")));

        List<CanonicalItem> inserted = db.storeItems(sub.id(), SourceType.NEWS, List.of(
                item("A", "http://x/1"), item("B", "http://x/2"), item("C", "http://x/3")));

        assertEquals(List.of("A", "C"), inserted.stream().map(CanonicalItem::title).toList());
    }

    @Test
    void storeItems_shouldSkipItemsWithoutUrl() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");

        List<CanonicalItem> inserted = db.storeItems(sub.id(), SourceType.NEWS,
                List.of(item("No link", ""), item("Has link", "http://x/1")));

        assertEquals(1, inserted.size());
        assertEquals(1, db.countItems(sub.id()));
    }

    @Test
    void storeItems_sameUrlDifferentSubscription_shouldStoreBoth() {
        Subscription a = subscribe(SourceType.NEWS, "bbc");
        Subscription b = subscribe(SourceType.NEWS, "npr");

        db.storeItems(a.id(), SourceType.NEWS, List.of(item("A", "http://x/1")));
        db.storeItems(b.id(), SourceType.NEWS, List.of(item("A", "http://x/1")));

        assertEquals(2, db.getItems(null, 10).size());
    }

    @Test
    void storeItems_shouldPersistMetadataAsJson() {
        Subscription sub = subscribe(SourceType.HACKERNEWS, "top");
        CanonicalItem withMeta = item("HN", "http://x/1").withMetadata(Map.of("score", 42));

        db.storeItems(sub.id(), SourceType.HACKERNEWS, List.of(withMeta));

        FeedItem stored = db.getItems(SourceType.HACKERNEWS, 1).get(0);
        assertEquals("{\"score\":42}", stored.metadata());
        assertFalse(stored.fetchedAt().isBlank());
    }

    @Test
    void getItems_shouldReturnNewestFirstAndFilterByType() {
        Subscription news = subscribe(SourceType.NEWS, "bbc");
        Subscription reddit = subscribe(SourceType.REDDIT, "rust");
        db.storeItems(news.id(), SourceType.NEWS, List.of(item("first", "http://n/1")));
        db.storeItems(reddit.id(), SourceType.REDDIT, List.of(item("second", "http://r/1")));
        db.storeItems(news.id(), SourceType.NEWS, List.of(item("third", "http://n/2")));

        assertEquals(List.of("third", "second", "first"),
                db.getItems(null, 10).stream().map(FeedItem::title).toList());
        assertEquals(List.of("third", "first"),
                db.getItems(SourceType.NEWS, 10).stream().map(FeedItem::title).toList());
        assertEquals(1, db.getItems(null, 1).size());
    }

    // -- Search --

    @Test
    void search_shouldMatchTitleAndContent() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(
                new CanonicalItem("Rust 2.0 released", "http://x/1", "A new edition", "", ""),
                new CanonicalItem("Weather", "http://x/2", "Sunny with a chance of rust", "", ""),
                new CanonicalItem("Unrelated", "http://x/3", "Nothing here", "", "")));

        assertEquals(2, db.search("rust", 10).size());
        assertTrue(db.search("python", 10).isEmpty());
    }

    @Test
    void search_shouldRankTitleHitsWithMoreOccurrencesFirst() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(
                new CanonicalItem("Markets today", "http://x/1",
                        "Long article about many things, once mentioning climate among other topics", "", ""),
                new CanonicalItem("Climate climate climate", "http://x/2", "climate", "", "")));

        List<FeedItem> hits = db.search("climate", 10);
        assertEquals("http://x/2", hits.get(0).url());
    }

    @Test
    void search_shouldToleratePunctuationAndOperators() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(item("C++ \"modules\" arrive", "http://x/1")));

        assertEquals(1, assertDoesNotThrow(() -> db.search("c++ \"modules", 10)).size());
        assertTrue(assertDoesNotThrow(() -> db.search("AND OR NOT (", 10)).isEmpty());
        assertTrue(db.search("  ", 10).isEmpty());
    }

    @Test
    void search_shouldRespectLimit() {
        Subscription sub = subscribe(SourceType.NEWS, "bbc");
        db.storeItems(sub.id(), SourceType.NEWS, List.of(
                item("news one", "http://x/1"), item("news two", "http://x/2"), item("news three", "http://x/3")));

        assertEquals(2, db.search("news", 2).size());
    }

    // -- Helpers --

    private Subscription subscribe(SourceType type, String identifier) {
        return db.subscribe(type, identifier, identifier, "https://example.com/" + identifier).subscription();
    }

    private static CanonicalItem item(String title, String url) {
        return new CanonicalItem(title, url, "", "", "");
    }

    private int indexedDocuments() throws SQLException {
        try (Connection conn = db.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT count(*) FROM feed_items_fts_docsize")) {
            return rs.next() ? rs.getInt(1) : -1;
        }
    }
}
