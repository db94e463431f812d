package org.crynn.storage.history;

import org.crynn.storage.index.StorageIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Visit log, one row per URL, capped at {@code maxItems} rows after each cleanup pass.
 */
public class HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private static final String SELECT_COLUMNS = "SELECT url, title, visit_count, last_visit, created_at FROM history";

    private final StorageIndex index;
    private final int maxItems;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public HistoryStore(StorageIndex index, int maxItems, Clock clock) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be > 0, got " + maxItems);
        }
        this.index = Objects.requireNonNull(index, "index");
        this.maxItems = maxItems;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a visit: bumps {@code visit_count} and {@code last_visit}, or inserts the URL on its
     * first visit. A non-null title replaces the stored one.
     */
    public HistoryItem recordVisit(String url, String title) {
        Objects.requireNonNull(url, "url");
        long now = clock.millis();
        writeLock.lock();
        try {
            index.inTransaction(conn -> {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE history SET visit_count = visit_count + 1, last_visit = ?, title = COALESCE(?, title) WHERE url = ?")) {
                    ps.setLong(1, now);
                    ps.setString(2, title);
                    ps.setString(3, url);
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(
                            "INSERT INTO history (url, title, visit_count, last_visit, created_at) VALUES (?, ?, 1, ?, ?)")) {
                        ps.setString(1, url);
                        ps.setString(2, title);
                        ps.setLong(3, now);
                        ps.setLong(4, now);
                        ps.executeUpdate();
                    }
                }
                return null;
            });
            return get(url).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<HistoryItem> get(String url) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE url = ?")) {
                ps.setString(1, url);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<HistoryItem>empty();
                }
            }
        });
    }

    /** Most recently visited first. */
    public List<HistoryItem> recent(int limit) {
        int lim = Math.max(1, limit);
        return list(SELECT_COLUMNS + " ORDER BY last_visit DESC, id DESC LIMIT " + lim, null);
    }

    /** Case-insensitive match on url or title, most recent first. */
    public List<HistoryItem> search(String query, int limit) {
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) return recent(limit);
        int lim = Math.max(1, limit);
        String like = "%" + q.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        return list(SELECT_COLUMNS + " WHERE LOWER(url) LIKE ? ESCAPE '\\' OR LOWER(title) LIKE ? ESCAPE '\\' "
                + "ORDER BY last_visit DESC, id DESC LIMIT " + lim, like);
    }

    /**
     * Immutable copy of the whole log, oldest visit first. Reading it never changes the store.
     */
    public List<HistoryItem> snapshot() {
        return List.copyOf(list(SELECT_COLUMNS + " ORDER BY last_visit ASC, id ASC", null));
    }

    public boolean remove(String url) {
        writeLock.lock();
        try {
            return index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM history WHERE url = ?")) {
                    ps.setString(1, url);
                    return ps.executeUpdate() > 0;
                }
            });
        } finally {
            writeLock.unlock();
        }
    }

    public int clear() {
        writeLock.lock();
        try {
            int removed = index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM history")) {
                    return ps.executeUpdate();
                }
            });
            log.info("Cleared {} history items", removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Trims the log to {@code maxItems}, dropping the least recently visited rows first.
     * Returns the number of rows removed.
     */
    public int cleanup() {
        writeLock.lock();
        try {
            long count = count();
            if (count <= maxItems) return 0;
            long excess = count - maxItems;
            int removed = index.inTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM history WHERE id IN ("
                                + "SELECT id FROM history ORDER BY last_visit ASC, id ASC LIMIT ?)")) {
                    ps.setLong(1, excess);
                    return ps.executeUpdate();
                }
            });
            log.info("History cleanup removed {} items (cap={})", removed, maxItems);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public long count() {
        return index.count("history");
    }

    public int maxItems() {
        return maxItems;
    }

    private List<HistoryItem> list(String sql, String like) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (like != null) {
                    ps.setString(1, like);
                    ps.setString(2, like);
                }
                List<HistoryItem> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
                return out;
            }
        });
    }

    private static HistoryItem map(ResultSet rs) throws SQLException {
        return new HistoryItem(
                rs.getString("url"),
                rs.getString("title"),
                rs.getInt("visit_count"),
                Instant.ofEpochMilli(rs.getLong("last_visit")),
                Instant.ofEpochMilli(rs.getLong("created_at"))
        );
    }
}
