package org.crynn.storage.bookmark;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.crynn.storage.index.StorageIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.concurrent.locks.ReentrantLock;

/**
 * User bookmarks, one per URL. Nothing is removed except by explicit calls.
 */
public class BookmarkStore {
    private static final Logger log = LoggerFactory.getLogger(BookmarkStore.class);

    public static final String DEFAULT_FOLDER = "default";

    private static final String SELECT_COLUMNS = "SELECT url, title, folder, created_at FROM bookmarks";

    /** JSON layout of {@link #exportJson()}. */
    public record ExportFile(List<ExportEntry> bookmarks) {}

    public record ExportEntry(String url, String title, String folder, long createdAt) {}

    private final StorageIndex index;
    private final int maxBookmarks;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public BookmarkStore(StorageIndex index, int maxBookmarks, Clock clock, ObjectMapper mapper) {
        if (maxBookmarks <= 0) {
            throw new IllegalArgumentException("maxBookmarks must be > 0, got " + maxBookmarks);
        }
        this.index = Objects.requireNonNull(index, "index");
        this.maxBookmarks = maxBookmarks;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Bookmark add(String url, String title) {
        return add(url, title, null);
    }

    /**
     * Bookmarks {@code url}. An existing bookmark for the same URL gets the new title and folder
     * and keeps its creation time.
     *
     * @throws BookmarkCapacityException if the URL is new and the store is full
     */
    public Bookmark add(String url, String title, String folder) {
        Objects.requireNonNull(url, "url");
        String t = title == null ? url : title;
        String f = normalizeFolder(folder);
        long now = clock.millis();
        writeLock.lock();
        try {
            index.inTransaction(conn -> {
                if (updateRow(conn, url, t, f) == 0) {
                    if (countRows(conn) >= maxBookmarks) {
                        throw new BookmarkCapacityException(maxBookmarks);
                    }
                    insertRow(conn, url, t, f, now);
                }
                return null;
            });
            log.debug("Bookmarked {} in folder {}", url, f);
            return get(url).orElseThrow();
        } finally {
            writeLock.unlock();
        }
    }

    /** Changes title and folder of an existing bookmark. Empty if the URL is not bookmarked. */
    public Optional<Bookmark> update(String url, String title, String folder) {
        writeLock.lock();
        try {
            Optional<Bookmark> existing = get(url);
            if (existing.isEmpty()) return Optional.empty();
            String t = title == null ? existing.get().title() : title;
            String f = folder == null ? existing.get().folder() : normalizeFolder(folder);
            index.query(conn -> updateRow(conn, url, t, f));
            return get(url);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean remove(String url) {
        writeLock.lock();
        try {
            return index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM bookmarks WHERE url = ?")) {
                    ps.setString(1, url);
                    return ps.executeUpdate() > 0;
                }
            });
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Bookmark> get(String url) {
        List<Bookmark> found = query(SELECT_COLUMNS + " WHERE url = ?", url);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /** All bookmarks in creation order. */
    public List<Bookmark> list() {
        return list(null);
    }

    /** Bookmarks of one folder, or all of them when {@code folder} is null. */
    public List<Bookmark> list(String folder) {
        if (folder == null) {
            return query(SELECT_COLUMNS + " ORDER BY created_at, id", null);
        }
        return query(SELECT_COLUMNS + " WHERE folder = ? ORDER BY created_at, id", folder);
    }

    public List<String> folders() {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT DISTINCT folder FROM bookmarks ORDER BY folder");
                 ResultSet rs = ps.executeQuery()) {
                List<String> out = new ArrayList<>();
                while (rs.next()) out.add(rs.getString(1));
                return out;
            }
        });
    }

    public long count() {
        return index.count("bookmarks");
    }

    public int clear() {
        writeLock.lock();
        try {
            int removed = index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM bookmarks")) {
                    return ps.executeUpdate();
                }
            });
            log.info("Cleared {} bookmarks", removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /** Bookmarks are never evicted automatically. */
    public int cleanup() {
        return 0;
    }

    public String exportJson() {
        List<ExportEntry> entries = list().stream()
                .map(b -> new ExportEntry(b.url(), b.title(), b.folder(), b.createdAt().toEpochMilli()))
                .toList();
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ExportFile(entries));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bookmarks", e);
        }
    }

    /**
     * Imports a document produced by {@link #exportJson()}, upserting by URL. New bookmarks keep
     * their exported creation time. The import is all or nothing: when the new URLs do not fit
     * under the capacity, nothing is written.
     * Returns the number of bookmarks written.
     *
     * @throws IllegalArgumentException if {@code json} is not a bookmark export
     * @throws BookmarkCapacityException if the import would exceed the capacity
     */
    public int importJson(String json) {
        ExportFile file;
        try {
            file = mapper.readValue(json, ExportFile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a bookmark export", e);
        }
        if (file == null || file.bookmarks() == null) {
            throw new IllegalArgumentException("Not a bookmark export: missing 'bookmarks'");
        }
        long now = clock.millis();
        int written;
        writeLock.lock();
        try {
            written = index.inTransaction(conn -> {
                int n = 0;
                for (ExportEntry e : file.bookmarks()) {
                    if (e.url() == null || e.url().isBlank()) continue;
                    String t = e.title() == null ? e.url() : e.title();
                    String f = normalizeFolder(e.folder());
                    if (updateRow(conn, e.url(), t, f) == 0) {
                        if (countRows(conn) >= maxBookmarks) {
                            throw new BookmarkCapacityException(maxBookmarks);
                        }
                        insertRow(conn, e.url(), t, f, e.createdAt() > 0 ? e.createdAt() : now);
                    }
                    n++;
                }
                return n;
            });
        } finally {
            writeLock.unlock();
        }
        log.info("Imported {} bookmarks", written);
        return written;
    }

    private static String normalizeFolder(String folder) {
        return (folder == null || folder.isBlank()) ? DEFAULT_FOLDER : folder.trim();
    }

    private static int updateRow(Connection conn, String url, String title, String folder) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE bookmarks SET title = ?, folder = ? WHERE url = ?")) {
            ps.setString(1, title);
            ps.setString(2, folder);
            ps.setString(3, url);
            return ps.executeUpdate();
        }
    }

    private static void insertRow(Connection conn, String url, String title, String folder, long now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO bookmarks (url, title, folder, created_at) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, url);
            ps.setString(2, title);
            ps.setString(3, folder);
            ps.setLong(4, now);
            ps.executeUpdate();
        }
    }

    private static long countRows(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM bookmarks");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private List<Bookmark> query(String sql, String param) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (param != null) ps.setString(1, param);
                List<Bookmark> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new Bookmark(
                                rs.getString("url"),
                                rs.getString("title"),
                                rs.getString("folder"),
                                Instant.ofEpochMilli(rs.getLong("created_at"))));
                    }
                }
                return out;
            }
        });
    }
}
