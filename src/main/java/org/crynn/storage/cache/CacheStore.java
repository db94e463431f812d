package org.crynn.storage.cache;

import org.crynn.storage.StorageIoException;
import org.crynn.storage.index.StorageIndex;
import org.crynn.storage.util.BlobNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, disk-backed resource cache.
 *
 * <p>Content lives in one blob per key under the cache directory, named by the SHA-256 of the key
 * (see {@link BlobNames}). Metadata lives in the {@code cache_entries} table of the shared index.
 * A row exists iff its blob exists; a row whose blob went missing is dropped on the next read.
 *
 * <p>Mutations (put, remove, eviction, healing) run under a single lock, the same boundary that
 * guards the aggregate size counter. Reads take no lock.
 */
public class CacheStore implements CacheMetrics {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final String SELECT_COLUMNS =
            "SELECT id, cache_key, content_type, file_ref, size, created_at, accessed_at, expires_at FROM cache_entries";

    private final StorageIndex index;
    private final Path cacheDir;
    private final SizeBudget budget;
    private final Clock clock;
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public CacheStore(StorageIndex index, Path cacheDir, long maxSizeBytes, Clock clock) {
        this.index = Objects.requireNonNull(index, "index");
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.budget = new SizeBudget(maxSizeBytes);
        try {
            Files.createDirectories(this.cacheDir);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create cache directory: " + this.cacheDir, e);
        }
        budget.reset(sumOfRowSizes());
        log.info("Initialized cache with max capacity: {} bytes, {} bytes in use, dir={}",
                budget.maxBytes(), budget.used(), this.cacheDir);
    }

    public void put(String key, String contentType, byte[] bytes) {
        put(key, contentType, bytes, null);
    }

    /**
     * Stores {@code bytes} under {@code key}, replacing any previous entry, then evicts least
     * recently used entries while the cache is over budget.
     *
     * @throws StorageIoException if the blob or the row could not be written; nothing is left behind
     */
    public void put(String key, String contentType, byte[] bytes, Instant expiresAt) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(bytes, "bytes");
        String ct = (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType;
        String fileRef = BlobNames.fileRef(key);
        Path blob = cacheDir.resolve(fileRef);

        mutationLock.lock();
        try {
            Path staged = stageBlob(key, blob, bytes);
            long now = clock.millis();
            AtomicBoolean moved = new AtomicBoolean(false);
            long previousSize;
            try {
                previousSize = index.inTransaction(conn -> {
                    long previous = selectSize(conn, key);
                    try (PreparedStatement ps = conn.prepareStatement(
                            "MERGE INTO cache_entries (cache_key, content_type, file_ref, size, created_at, accessed_at, expires_at) "
                                    + "KEY (cache_key) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                        ps.setString(1, key);
                        ps.setString(2, ct);
                        ps.setString(3, fileRef);
                        ps.setLong(4, bytes.length);
                        ps.setLong(5, now);
                        ps.setLong(6, now);
                        StorageIndex.setNullableLong(ps, 7, expiresAt == null ? null : expiresAt.toEpochMilli());
                        ps.executeUpdate();
                    }
                    Files.move(staged, blob, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                    moved.set(true);
                    return previous;
                });
            } catch (RuntimeException e) {
                deleteQuietly(staged);
                if (moved.get()) {
                    // The commit failed after the blob was published: drop both sides.
                    discardAfterFailedCommit(key, blob);
                }
                throw e;
            }

            budget.add(bytes.length - Math.max(0L, previousSize));
            log.debug("Cached {} ({} bytes, replaced={})", key, bytes.length, previousSize >= 0);
            evictUntilWithinBudget();
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Returns the entry and its content, updating {@code accessed_at}. Absent, expired or
     * corrupted entries (blob missing or truncated) come back empty; corrupted rows are removed.
     */
    public Optional<CachedResource> get(String key) {
        Objects.requireNonNull(key, "key");
        Optional<CacheEntry> found = entry(key);
        Instant now = clock.instant();
        if (found.isEmpty() || found.get().isExpired(now)) {
            misses.increment();
            return Optional.empty();
        }
        CacheEntry entry = found.get();
        Path blob = cacheDir.resolve(entry.fileRef());

        byte[] content;
        try {
            content = Files.readAllBytes(blob);
        } catch (NoSuchFileException e) {
            healMissingBlob(entry);
            misses.increment();
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageIoException("Failed to read blob for " + key, e);
        }
        if (content.length != entry.sizeBytes()) {
            log.warn("Cache blob for {} has {} bytes, index says {}; dropping entry", key, content.length, entry.sizeBytes());
            healMissingBlob(entry);
            misses.increment();
            return Optional.empty();
        }

        index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE cache_entries SET accessed_at = ? WHERE cache_key = ?")) {
                ps.setLong(1, now.toEpochMilli());
                ps.setString(2, key);
                return ps.executeUpdate();
            }
        });
        hits.increment();
        return Optional.of(new CachedResource(entry.withAccessedAt(now), content));
    }

    /** Index row for {@code key} without touching the blob or the access time. */
    public Optional<CacheEntry> entry(String key) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE cache_key = ?")) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapEntry(rs)) : Optional.<CacheEntry>empty();
                }
            }
        });
    }

    public boolean remove(String key) {
        Objects.requireNonNull(key, "key");
        mutationLock.lock();
        try {
            Optional<Candidate> c = candidate(key);
            if (c.isEmpty()) return false;
            deleteEntry(c.get());
            budget.release(c.get().size());
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    /** Removes every entry. Returns the number of entries dropped. */
    public int clear() {
        mutationLock.lock();
        try {
            int removed = 0;
            for (Candidate c : candidates(SELECT_COLUMNS + " ORDER BY id", null)) {
                try {
                    deleteEntry(c);
                    removed++;
                } catch (RuntimeException e) {
                    log.warn("Failed to clear cache entry {}", c.key(), e);
                }
            }
            budget.reset(sumOfRowSizes());
            log.info("Cleared {} cache entries", removed);
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Drops expired entries, then evicts in ascending {@code accessed_at} order (ties by
     * {@code created_at}, then insertion order) until the aggregate size is within budget.
     * Per-entry failures are logged and skipped.
     */
    public CleanupResult cleanup() {
        mutationLock.lock();
        try {
            long now = clock.millis();
            int expired = 0;
            long freed = 0L;
            for (Candidate c : candidates(SELECT_COLUMNS + " WHERE expires_at IS NOT NULL AND expires_at < ? ORDER BY id", now)) {
                try {
                    deleteEntry(c);
                    expired++;
                    freed += c.size();
                } catch (RuntimeException e) {
                    log.warn("Failed to remove expired cache entry {}", c.key(), e);
                }
            }

            // The counter may have drifted; eviction decisions use the actual row sizes.
            budget.reset(sumOfRowSizes());
            EvictionTally tally = evictUntilWithinBudget();
            freed += tally.bytes();

            CleanupResult result = new CleanupResult(expired, tally.count(), freed, budget.used());
            if (result.removed() > 0) {
                log.info("Cache cleanup: expired={} evicted={} freed={} bytes remaining={} bytes",
                        expired, tally.count(), freed, budget.used());
            }
            return result;
        } finally {
            mutationLock.unlock();
        }
    }

    public long count() {
        return index.count("cache_entries");
    }

    public long sizeBytes() {
        return budget.used();
    }

    public long maxSizeBytes() {
        return budget.maxBytes();
    }

    /** Changes the budget. Takes effect on the next put or cleanup. */
    public void setMaxSizeBytes(long maxSizeBytes) {
        budget.setMaxBytes(maxSizeBytes);
        log.info("Cache budget set to {} bytes", maxSizeBytes);
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /** Where the blob for {@code key} lives, whether or not it exists. */
    public Path blobPath(String key) {
        return cacheDir.resolve(BlobNames.fileRef(key));
    }

    @Override
    public long hits() {
        return hits.sum();
    }

    @Override
    public long misses() {
        return misses.sum();
    }

    @Override
    public long bytesUsed() {
        return budget.used();
    }

    // ---------------------------------------------------------------------------------------

    private record Candidate(long id, String key, String fileRef, long size) {}

    private record EvictionTally(int count, long bytes) {}

    private Path stageBlob(String key, Path blob, byte[] bytes) {
        Path tmp = null;
        try {
            Files.createDirectories(blob.getParent());
            tmp = Files.createTempFile(blob.getParent(), "crynn-", ".tmp");
            Files.write(tmp, bytes);
            return tmp;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageIoException("Failed to write blob for " + key, e);
        }
    }

    // Caller holds mutationLock.
    private EvictionTally evictUntilWithinBudget() {
        if (!budget.isOverBudget()) return new EvictionTally(0, 0L);

        int evicted = 0;
        long freed = 0L;
        List<Candidate> lru = candidates(SELECT_COLUMNS + " ORDER BY accessed_at ASC, created_at ASC, id ASC", null);
        for (Candidate c : lru) {
            if (!budget.isOverBudget()) break;
            try {
                deleteEntry(c);
                budget.release(c.size());
                evicted++;
                freed += c.size();
                log.debug("Evicted {} ({} bytes)", c.key(), c.size());
            } catch (RuntimeException e) {
                log.warn("Failed to evict cache entry {}", c.key(), e);
            }
        }
        if (budget.isOverBudget() && lru.size() == evicted) {
            // Nothing left to evict; whatever remains on the counter is drift.
            budget.reset(0L);
        }
        if (evicted > 0) {
            log.info("Evicted {} cache entries ({} bytes), {} bytes in use", evicted, freed, budget.used());
        }
        return new EvictionTally(evicted, freed);
    }

    private void healMissingBlob(CacheEntry seen) {
        mutationLock.lock();
        try {
            Optional<Candidate> current = candidate(seen.key());
            if (current.isEmpty()) return;
            Path blob = cacheDir.resolve(current.get().fileRef());
            Optional<CacheEntry> row = entry(seen.key());
            boolean intact = Files.exists(blob) && row.isPresent() && fileSize(blob) == row.get().sizeBytes();
            if (intact) {
                // Replaced concurrently with a healthy blob.
                return;
            }
            log.warn("Cache entry {} has no usable blob at {}; removing row", seen.key(), blob);
            deleteEntry(current.get());
            budget.release(current.get().size());
        } finally {
            mutationLock.unlock();
        }
    }

    private void discardAfterFailedCommit(String key, Path blob) {
        deleteQuietly(blob);
        try {
            Optional<Candidate> stale = candidate(key);
            if (stale.isPresent()) {
                deleteEntry(stale.get());
                budget.release(stale.get().size());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to drop row for {} after failed commit; it will be healed on read", key, e);
        }
    }

    private void deleteEntry(Candidate c) {
        Path blob = cacheDir.resolve(c.fileRef());
        index.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM cache_entries WHERE id = ?")) {
                ps.setLong(1, c.id());
                ps.executeUpdate();
            }
            Files.deleteIfExists(blob);
            return null;
        });
    }

    private Optional<Candidate> candidate(String key) {
        List<Candidate> found = candidates(SELECT_COLUMNS + " WHERE cache_key = ?", key);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private List<Candidate> candidates(String sql, Object param) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (param instanceof Long l) {
                    ps.setLong(1, l);
                } else if (param instanceof String s) {
                    ps.setString(1, s);
                }
                List<Candidate> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new Candidate(rs.getLong("id"), rs.getString("cache_key"),
                                rs.getString("file_ref"), rs.getLong("size")));
                    }
                }
                return out;
            }
        });
    }

    private long sumOfRowSizes() {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(SUM(size), 0) FROM cache_entries");
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    private static long selectSize(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT size FROM cache_entries WHERE cache_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : -1L;
            }
        }
    }

    private static CacheEntry mapEntry(ResultSet rs) throws SQLException {
        Long expires = StorageIndex.nullableLong(rs, "expires_at");
        return new CacheEntry(
                rs.getString("cache_key"),
                rs.getString("content_type"),
                rs.getLong("size"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("accessed_at")),
                expires == null ? null : Instant.ofEpochMilli(expires),
                rs.getString("file_ref")
        );
    }

    private static long fileSize(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return -1L;
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Failed to delete {}", p, e);
        }
    }
}
