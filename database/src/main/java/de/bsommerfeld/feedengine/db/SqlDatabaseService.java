package de.bsommerfeld.feedengine.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedengine.core.config.StoreConfig;
import de.bsommerfeld.feedengine.core.domain.CanonicalItem;
import de.bsommerfeld.feedengine.core.domain.FeedItem;
import de.bsommerfeld.feedengine.core.domain.SourceType;
import de.bsommerfeld.feedengine.core.domain.Subscription;
import de.bsommerfeld.feedengine.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Every connection enables foreign keys (required for the
 * {@code ON DELETE CASCADE} on {@code feed_items}) and uses WAL journaling so
 * readers are not blocked by the writer.
 *
 * <h3>Full-text index</h3>
 * {@code feed_items_fts} is an FTS5 external-content table maintained by
 * insert and delete triggers on {@code feed_items}. The triggers run inside
 * the statement's transaction, so the index commits or rolls back together
 * with the rows it mirrors.
 *
 * @see SqlLoader
 * @see FeedRepository
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    private final String dbUrl;
    private final Properties connectionProperties;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public SqlDatabaseService(StoreConfig storeConfig) {
        Path dbFile = storeConfig.resolvePath();
        try {
            Path parent = dbFile.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory for " + dbFile, e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile;

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.enforceForeignKeys(true);
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setBusyTimeout(5000);
        this.connectionProperties = sqliteConfig.toProperties();

        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreException("Database initialization failed", e);
        }
    }

    /** Applies every statement of {@code schema.sql} in one transaction. */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.schemaStatements();
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements)
                stmt.execute(sql);
            conn.commit();
            LOG.info("Database schema applied ({} statements).", statements.size());
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Subscriptions
    // =====================================================================

    @Override
    public SubscribeResult subscribe(SourceType sourceType, String identifier, String name, String feedUrl) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                int inserted;
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-subscription"))) {
                    ps.setString(1, sourceType.wireName());
                    ps.setString(2, identifier);
                    ps.setString(3, name);
                    ps.setString(4, feedUrl);
                    ps.setString(5, now());
                    inserted = ps.executeUpdate();
                }
                Subscription row = findSubscription(conn, sourceType, identifier)
                        .orElseThrow(() -> new SQLException("Subscription vanished after insert: "
                                + sourceType + ":" + identifier));
                conn.commit();

                if (inserted == 0) {
                    LOG.debug("[DB] Already subscribed: {}:{}", sourceType, identifier);
                    return SubscribeResult.alreadySubscribed(row);
                }
                LOG.info("[DB] Subscribed {}:{} as '{}'", sourceType, identifier, name);
                return SubscribeResult.created(row);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Failed to subscribe {}:{}", sourceType, identifier, e);
            throw new StoreException("Failed to subscribe " + sourceType + ":" + identifier, e);
        }
    }

    /**
     * Deletes items first, then the subscription. The explicit item delete
     * fires the FTS delete trigger for every row; the foreign key cascade
     * stays in place for rows written by other tools.
     */
    @Override
    public UnsubscribeResult unsubscribe(SourceType sourceType, String identifier) {
        try (Connection conn = getConnection()) {
            Optional<Subscription> existing = findSubscription(conn, sourceType, identifier);
            if (existing.isEmpty())
                return UnsubscribeResult.notFound();

            long id = existing.get().id();
            conn.setAutoCommit(false);
            try {
                int removedItems;
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-items-for-subscription"))) {
                    ps.setLong(1, id);
                    removedItems = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-subscription"))) {
                    ps.setLong(1, id);
                    ps.executeUpdate();
                }
                conn.commit();
                LOG.info("[DB] Unsubscribed {}:{}, removed {} items", sourceType, identifier, removedItems);
                return new UnsubscribeResult(existing, removedItems);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Failed to unsubscribe {}:{}", sourceType, identifier, e);
            throw new StoreException("Failed to unsubscribe " + sourceType + ":" + identifier, e);
        }
    }

    @Override
    public List<Subscription> listSubscriptions() {
        List<Subscription> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-subscriptions"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                result.add(mapSubscription(rs));
        } catch (SQLException e) {
            LOG.error("Failed to list subscriptions", e);
            throw new StoreException("Failed to list subscriptions", e);
        }
        return result;
    }

    @Override
    public Optional<Subscription> getSubscription(SourceType sourceType, String identifier) {
        try (Connection conn = getConnection()) {
            return findSubscription(conn, sourceType, identifier);
        } catch (SQLException e) {
            LOG.error("Failed to fetch subscription {}:{}", sourceType, identifier, e);
            throw new StoreException("Failed to fetch subscription", e);
        }
    }

    private Optional<Subscription> findSubscription(Connection conn, SourceType sourceType, String identifier)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subscription"))) {
            ps.setString(1, sourceType.wireName());
            ps.setString(2, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapSubscription(rs)) : Optional.empty();
            }
        }
    }

    // =====================================================================
    // Items
    // =====================================================================

    @Override
    public List<CanonicalItem> storeItems(long subscriptionId, SourceType sourceType, List<CanonicalItem> items) {
        List<CanonicalItem> inserted = new ArrayList<>();
        if (items == null || items.isEmpty())
            return inserted;

        String fetchedAt = now();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-item"))) {
                for (CanonicalItem item : items) {
                    if (!item.hasUrl())
                        continue;
                    bindItem(ps, subscriptionId, sourceType, item, fetchedAt);
                    if (ps.executeUpdate() > 0)
                        inserted.add(item);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Failed to store items for subscription {}", subscriptionId, e);
            throw new StoreException("Failed to store items for subscription " + subscriptionId, e);
        }

        LOG.debug("[DB] Stored {} of {} items for subscription {}", inserted.size(), items.size(), subscriptionId);
        return inserted;
    }

    /** Binds all 9 item parameters to the insert prepared statement. */
    private void bindItem(PreparedStatement ps, long subscriptionId, SourceType sourceType, CanonicalItem item,
            String fetchedAt) throws SQLException {
        ps.setLong(1, subscriptionId);
        ps.setString(2, sourceType.wireName());
        ps.setString(3, item.title());
        ps.setString(4, item.url());
        ps.setString(5, item.content());
        ps.setString(6, item.published());
        ps.setString(7, item.author());
        ps.setString(8, toJson(item));
        ps.setString(9, fetchedAt);
    }

    @Override
    public List<FeedItem> search(String query, int limit) {
        String match = SearchQuery.toMatchExpression(query);
        if (match.isEmpty())
            return new ArrayList<>();
        return queryItems(SqlLoader.load("search-items"), ps -> {
            ps.setString(1, match);
            ps.setInt(2, limit);
        });
    }

    @Override
    public List<FeedItem> getItems(SourceType sourceType, int limit) {
        if (sourceType == null) {
            return queryItems(SqlLoader.load("select-recent-items"), ps -> ps.setInt(1, limit));
        }
        return queryItems(SqlLoader.load("select-recent-items-by-type"), ps -> {
            ps.setString(1, sourceType.wireName());
            ps.setInt(2, limit);
        });
    }

    @Override
    public int countItems(long subscriptionId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-items-for-subscription"))) {
            ps.setLong(1, subscriptionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            LOG.error("Failed to count items for subscription {}", subscriptionId, e);
            throw new StoreException("Failed to count items", e);
        }
    }

    private List<FeedItem> queryItems(String sql, StatementBinder binder) {
        List<FeedItem> results = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    results.add(mapItem(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to query feed items", e);
            throw new StoreException("Failed to query feed items", e);
        }
        return results;
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private Subscription mapSubscription(ResultSet rs) throws SQLException {
        return new Subscription(
                rs.getLong("id"), SourceType.fromName(rs.getString("source_type")),
                rs.getString("identifier"), rs.getString("name"),
                rs.getString("feed_url"), rs.getString("created_at"));
    }

    private FeedItem mapItem(ResultSet rs) throws SQLException {
        return new FeedItem(
                rs.getLong("id"), rs.getLong("subscription_id"),
                SourceType.fromName(rs.getString("source_type")),
                rs.getString("title"), rs.getString("url"), rs.getString("content"),
                rs.getString("published"), rs.getString("author"),
                rs.getString("metadata"), rs.getString("fetched_at"));
    }

    private String toJson(CanonicalItem item) throws SQLException {
        if (item.metadata().isEmpty())
            return "{}";
        try {
            return mapper.writeValueAsString(item.metadata());
        } catch (JsonProcessingException e) {
            throw new SQLException("Metadata is not serializable for " + item.url(), e);
        }
    }

    private static String now() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
