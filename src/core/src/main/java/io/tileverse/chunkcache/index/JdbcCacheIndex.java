/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkcache.index;

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CacheIndex} backed by a relational database through plain JDBC.
 * <p>
 * Uses two tables, {@code cache_entries} unique on {@code (source_id, media_id, quality)}, and
 * {@code cache_chunks} unique on {@code (cache_entry_id, start_byte, end_byte)}. The latter constraint makes
 * {@link #recordChunk} idempotent even across concurrent writers. {@code end_byte} is exclusive.
 * <p>
 * Every operation borrows its own connection from the {@link DataSource} and runs in auto-commit mode.
 */
public class JdbcCacheIndex implements CacheIndex {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCacheIndex.class);

    static final String CREATE_ENTRIES = """
            CREATE TABLE IF NOT EXISTS cache_entries (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_id VARCHAR(255) NOT NULL,
                media_id VARCHAR(255) NOT NULL,
                quality VARCHAR(64) NOT NULL,
                original_url VARCHAR(4096) NOT NULL,
                file_path VARCHAR(4096) NOT NULL,
                expected_total_size BIGINT,
                is_complete BOOLEAN DEFAULT FALSE NOT NULL,
                created_at TIMESTAMP NOT NULL,
                last_accessed TIMESTAMP NOT NULL,
                CONSTRAINT uq_cache_entries_key UNIQUE (source_id, media_id, quality)
            )""";

    static final String CREATE_CHUNKS = """
            CREATE TABLE IF NOT EXISTS cache_chunks (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                cache_entry_id BIGINT NOT NULL,
                start_byte BIGINT NOT NULL,
                end_byte BIGINT NOT NULL,
                downloaded_at TIMESTAMP NOT NULL,
                CONSTRAINT fk_cache_chunks_entry FOREIGN KEY (cache_entry_id)
                    REFERENCES cache_entries (id) ON DELETE CASCADE,
                CONSTRAINT uq_cache_chunks_range UNIQUE (cache_entry_id, start_byte, end_byte)
            )""";

    private static final String ENTRY_COLUMNS = "id, source_id, media_id, quality, original_url, file_path, "
            + "expected_total_size, is_complete, created_at, last_accessed";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcCacheIndex(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcCacheIndex(DataSource dataSource, Clock clock) {
        this.dataSource = requireNonNull(dataSource, "dataSource");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Creates the tables if they don't exist yet.
     *
     * @return this
     */
    public JdbcCacheIndex initialize() throws CacheIndexException {
        try (Connection c = dataSource.getConnection();
                Statement st = c.createStatement()) {
            st.execute(CREATE_ENTRIES);
            st.execute(CREATE_CHUNKS);
        } catch (SQLException e) {
            throw new CacheIndexException("Unable to create cache index schema", e);
        }
        logger.debug("Cache index schema initialized");
        return this;
    }

    @Override
    public Optional<CacheEntry> findEntry(long entryId) throws CacheIndexException {
        String sql = "SELECT " + ENTRY_COLUMNS + " FROM cache_entries WHERE id = ?";
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, entryId);
            return readEntry(ps);
        } catch (SQLException e) {
            throw new CacheIndexException("Error querying cache entry " + entryId, e);
        }
    }

    @Override
    public Optional<CacheEntry> findEntry(CacheEntryKey key) throws CacheIndexException {
        String sql = "SELECT " + ENTRY_COLUMNS
                + " FROM cache_entries WHERE source_id = ? AND media_id = ? AND quality = ?";
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.sourceId());
            ps.setString(2, key.mediaId());
            ps.setString(3, key.quality());
            return readEntry(ps);
        } catch (SQLException e) {
            throw new CacheIndexException("Error querying cache entry " + key, e);
        }
    }

    @Override
    public CacheEntry getOrCreateEntry(CacheEntryKey key, URI originalUrl, Path filePath)
            throws CacheIndexException {
        Optional<CacheEntry> existing = findEntry(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        String sql = "INSERT INTO cache_entries (source_id, media_id, quality, original_url, file_path, "
                + "is_complete, created_at, last_accessed) VALUES (?, ?, ?, ?, ?, FALSE, ?, ?)";
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.sourceId());
            ps.setString(2, key.mediaId());
            ps.setString(3, key.quality());
            ps.setString(4, originalUrl.toString());
            ps.setString(5, filePath.toString());
            ps.setTimestamp(6, now);
            ps.setTimestamp(7, now);
            ps.executeUpdate();
            logger.debug("Created cache entry {} for {}", key, originalUrl);
        } catch (SQLException e) {
            if (!isConstraintViolation(e)) {
                throw new CacheIndexException("Error creating cache entry " + key, e);
            }
            logger.debug("Cache entry {} created concurrently", key);
        }
        return findEntry(key)
                .orElseThrow(() -> new CacheIndexException("Cache entry vanished after insert: " + key, null));
    }

    @Override
    public void updateExpectedTotalSize(long entryId, long totalSize) throws CacheIndexException {
        update("UPDATE cache_entries SET expected_total_size = ? WHERE id = ?", entryId, ps -> {
            ps.setLong(1, totalSize);
            ps.setLong(2, entryId);
        });
    }

    @Override
    public void markComplete(long entryId) throws CacheIndexException {
        update("UPDATE cache_entries SET is_complete = TRUE WHERE id = ?", entryId, ps -> ps.setLong(1, entryId));
    }

    @Override
    public void markAccessed(long entryId) throws CacheIndexException {
        update("UPDATE cache_entries SET last_accessed = ? WHERE id = ?", entryId, ps -> {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setLong(2, entryId);
        });
    }

    @Override
    public boolean chunkExists(long entryId, long start, long end) throws CacheIndexException {
        String sql = "SELECT 1 FROM cache_chunks WHERE cache_entry_id = ? AND start_byte <= ? AND end_byte >= ?";
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, entryId);
            ps.setLong(2, start);
            ps.setLong(3, end);
            ps.setMaxRows(1);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new CacheIndexException(
                    "Error checking chunk [%d, %d) of entry %d".formatted(start, end, entryId), e);
        }
    }

    @Override
    public void recordChunk(long entryId, long start, long end) throws CacheIndexException {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk interval [%d, %d)".formatted(start, end));
        }
        String sql =
                "INSERT INTO cache_chunks (cache_entry_id, start_byte, end_byte, downloaded_at) VALUES (?, ?, ?, ?)";
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, entryId);
            ps.setLong(2, start);
            ps.setLong(3, end);
            ps.setTimestamp(4, Timestamp.from(clock.instant()));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e) && findEntry(entryId).isPresent()) {
                logger.debug("Chunk [{}, {}) of entry {} already recorded", start, end, entryId);
                return;
            }
            throw new CacheIndexException(
                    "Error recording chunk [%d, %d) of entry %d".formatted(start, end, entryId), e);
        }
    }

    @Override
    public List<ChunkRecord> listChunks(long entryId) throws CacheIndexException {
        String sql = "SELECT start_byte, end_byte, downloaded_at FROM cache_chunks WHERE cache_entry_id = ? "
                + "ORDER BY start_byte, end_byte";
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, entryId);
            List<ChunkRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new ChunkRecord(
                            entryId,
                            rs.getLong(1),
                            rs.getLong(2),
                            rs.getTimestamp(3).toInstant()));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new CacheIndexException("Error listing chunks of entry " + entryId, e);
        }
    }

    @Override
    public int deleteChunksInRange(long entryId, long start, long end) throws CacheIndexException {
        String delete = "DELETE FROM cache_chunks WHERE cache_entry_id = ? AND start_byte < ? AND end_byte > ?";
        String reset = "UPDATE cache_entries SET is_complete = FALSE WHERE id = ?";
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement(delete);
                    PreparedStatement upd = c.prepareStatement(reset)) {
                del.setLong(1, entryId);
                del.setLong(2, end);
                del.setLong(3, start);
                int removed = del.executeUpdate();
                upd.setLong(1, entryId);
                upd.executeUpdate();
                c.commit();
                return removed;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new CacheIndexException(
                    "Error deleting chunks in [%d, %d) of entry %d".formatted(start, end, entryId), e);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private void update(String sql, long entryId, StatementBinder binder) throws CacheIndexException {
        int updated;
        try (Connection c = dataSource.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new CacheIndexException("Error updating cache entry " + entryId, e);
        }
        if (updated == 0) {
            throw new CacheIndexException("Cache entry not found: " + entryId, null);
        }
    }

    private static Optional<CacheEntry> readEntry(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            long size = rs.getLong("expected_total_size");
            Long expectedTotalSize = rs.wasNull() ? null : size;
            return Optional.of(new CacheEntry(
                    rs.getLong("id"),
                    new CacheEntryKey(rs.getString("source_id"), rs.getString("media_id"), rs.getString("quality")),
                    URI.create(rs.getString("original_url")),
                    Path.of(rs.getString("file_path")),
                    expectedTotalSize,
                    rs.getBoolean("is_complete"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("last_accessed"))));
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp.toInstant();
    }

    static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }
}
