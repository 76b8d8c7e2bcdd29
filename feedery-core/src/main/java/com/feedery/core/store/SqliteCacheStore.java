package com.feedery.core.store;

import com.feedery.core.model.CacheRecord;
import com.feedery.core.model.ConditionalMetadata;
import com.feedery.core.model.Entry;
import com.feedery.core.model.SourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite implementation of CacheStore. Each save replaces the source row and its entry rows
 * inside one transaction. The single connection is shared, so access is serialized.
 */
public class SqliteCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteCacheStore.class);

    private final Path dbPath;
    private final Connection conn;

    public SqliteCacheStore(Path dbPath) {
        this.dbPath = dbPath;
        try {
            Files.createDirectories(dbPath.toAbsolutePath().getParent());
            this.conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            initSchema();
            log.info("Opened cache database at {}", dbPath);
        } catch (Exception e) {
            throw new CacheStoreException("Failed to open cache database: " + dbPath, e);
        }
    }

    private void initSchema() throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA foreign_keys=ON");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS sources (
                    url TEXT PRIMARY KEY,
                    etag TEXT,
                    last_modified TEXT,
                    last_fetched_at INTEGER,
                    last_checked_at INTEGER,
                    last_status INTEGER DEFAULT 0,
                    consecutive_failures INTEGER DEFAULT 0,
                    retry_after INTEGER,
                    last_error TEXT,
                    gone INTEGER DEFAULT 0,
                    resolved_url TEXT
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entries (
                    source_url TEXT NOT NULL,
                    position INTEGER NOT NULL,
                    id TEXT NOT NULL,
                    title TEXT,
                    link TEXT,
                    author TEXT,
                    summary TEXT,
                    content TEXT,
                    published_at INTEGER NOT NULL,
                    date_inferred INTEGER DEFAULT 0,
                    first_seen_at INTEGER NOT NULL,
                    source_name TEXT,
                    hidden INTEGER DEFAULT 0,
                    PRIMARY KEY (source_url, id),
                    FOREIGN KEY (source_url) REFERENCES sources(url) ON DELETE CASCADE
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS cache_meta (
                    key TEXT PRIMARY KEY,
                    value TEXT
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_entries_source ON entries(source_url, position)");
        }
    }

    // === Records ===

    @Override
    public synchronized Optional<CacheRecord> load(String sourceUrl) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM sources WHERE url = ?")) {
            ps.setString(1, sourceUrl);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ConditionalMetadata metadata = new ConditionalMetadata(
                    rs.getString("etag"),
                    rs.getString("last_modified"),
                    getInstant(rs, "last_fetched_at")
                );
                SourceStatus status = new SourceStatus(
                    getInstant(rs, "last_checked_at"),
                    rs.getInt("last_status"),
                    rs.getInt("consecutive_failures"),
                    getInstant(rs, "retry_after"),
                    rs.getString("last_error"),
                    rs.getInt("gone") == 1,
                    rs.getString("resolved_url")
                );
                return Optional.of(new CacheRecord(sourceUrl, metadata, status, loadEntries(sourceUrl)));
            }
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to load cache record for <" + sourceUrl + ">", e);
        }
    }

    private List<Entry> loadEntries(String sourceUrl) throws SQLException {
        List<Entry> entries = new ArrayList<>();
        String sql = "SELECT * FROM entries WHERE source_url = ? ORDER BY position";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sourceUrl);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(Entry.builder()
                        .id(rs.getString("id"))
                        .title(rs.getString("title"))
                        .link(rs.getString("link"))
                        .author(rs.getString("author"))
                        .summary(rs.getString("summary"))
                        .content(rs.getString("content"))
                        .publishedAt(getInstant(rs, "published_at"))
                        .dateInferred(rs.getInt("date_inferred") == 1)
                        .firstSeenAt(getInstant(rs, "first_seen_at"))
                        .sourceUrl(sourceUrl)
                        .sourceName(rs.getString("source_name"))
                        .hidden(rs.getInt("hidden") == 1)
                        .build());
                }
            }
        }
        return entries;
    }

    @Override
    public synchronized void save(CacheRecord record) {
        String upsert = """
            INSERT OR REPLACE INTO sources
            (url, etag, last_modified, last_fetched_at, last_checked_at, last_status,
             consecutive_failures, retry_after, last_error, gone, resolved_url)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String insertEntry = """
            INSERT INTO entries
            (source_url, position, id, title, link, author, summary, content,
             published_at, date_inferred, first_seen_at, source_name, hidden)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            conn.setAutoCommit(false);

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM entries WHERE source_url = ?")) {
                ps.setString(1, record.sourceUrl());
                ps.executeUpdate();
            }

            ConditionalMetadata metadata = record.metadata();
            SourceStatus status = record.status();
            try (PreparedStatement ps = conn.prepareStatement(upsert)) {
                ps.setString(1, record.sourceUrl());
                ps.setString(2, metadata.etag());
                ps.setString(3, metadata.lastModified());
                setInstant(ps, 4, metadata.lastFetchedAt());
                setInstant(ps, 5, status.lastCheckedAt());
                ps.setInt(6, status.lastStatus());
                ps.setInt(7, status.consecutiveFailures());
                setInstant(ps, 8, status.retryAfter());
                ps.setString(9, status.lastError());
                ps.setInt(10, status.gone() ? 1 : 0);
                ps.setString(11, status.resolvedUrl());
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement(insertEntry)) {
                int position = 0;
                for (Entry entry : record.entries()) {
                    ps.setString(1, record.sourceUrl());
                    ps.setInt(2, position++);
                    ps.setString(3, entry.id());
                    ps.setString(4, entry.title());
                    ps.setString(5, entry.link());
                    ps.setString(6, entry.author());
                    ps.setString(7, entry.summary());
                    ps.setString(8, entry.content());
                    setInstant(ps, 9, entry.publishedAt());
                    ps.setInt(10, entry.dateInferred() ? 1 : 0);
                    setInstant(ps, 11, entry.firstSeenAt());
                    ps.setString(12, entry.sourceName());
                    ps.setInt(13, entry.hidden() ? 1 : 0);
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            conn.commit();
        } catch (SQLException e) {
            rollback();
            throw new CacheStoreException("Failed to save cache record for <" + record.sourceUrl() + ">", e);
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public synchronized List<String> sourceUrls() {
        List<String> urls = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT url FROM sources ORDER BY url")) {
            while (rs.next()) {
                urls.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to list cached sources", e);
        }
        return urls;
    }

    @Override
    public synchronized void verifyWritable() {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO cache_meta (key, value) VALUES ('last_verified', ?)")) {
            ps.setString(1, String.valueOf(System.currentTimeMillis()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CacheStoreException("Cache database " + dbPath + " is not writable", e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Error closing cache database {}: {}", dbPath, e.getMessage());
        }
    }

    // === Helpers ===

    private void rollback() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed on {}: {}", dbPath, e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("Could not restore auto-commit on {}: {}", dbPath, e.getMessage());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, instant.toEpochMilli());
        }
    }
}
