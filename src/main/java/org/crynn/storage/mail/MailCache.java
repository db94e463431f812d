package org.crynn.storage.mail;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.crynn.storage.StorageIoException;
import org.crynn.storage.cache.CleanupResult;
import org.crynn.storage.cache.SizeBudget;
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
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded cache of mail headers, bodies and attachments.
 * <p>
 * A message costs its header size plus the size of its attachments. When the total goes over
 * budget, whole messages are evicted oldest-cached first.
 */
public class MailCache {
    private static final Logger log = LoggerFactory.getLogger(MailCache.class);

    private static final TypeReference<List<String>> FLAGS_TYPE = new TypeReference<>() {};

    private static final String SELECT_HEADERS =
            "SELECT uid, subject, from_addr, to_addr, sent_at, size, flags, folder FROM mail_headers";

    private static final String MESSAGE_SIZES =
            "SELECT (SELECT COALESCE(SUM(size), 0) FROM mail_headers) + (SELECT COALESCE(SUM(size), 0) FROM mail_attachments)";

    private final StorageIndex index;
    private final SizeBudget budget;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public MailCache(StorageIndex index, long maxSizeBytes, Clock clock, ObjectMapper mapper) {
        this.index = Objects.requireNonNull(index, "index");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.budget = new SizeBudget(maxSizeBytes);
        budget.reset(sumOfMessageSizes());
        log.info("Initialized mail cache with max capacity: {} bytes, {} bytes in use", budget.maxBytes(), budget.used());
    }

    /** Upserts headers by uid in one transaction, then enforces the budget. */
    public void storeHeaders(Collection<MailHeader> headers) {
        if (headers.isEmpty()) return;
        long now = clock.millis();
        mutationLock.lock();
        try {
            long delta = index.inTransaction(conn -> {
                long d = 0L;
                for (MailHeader h : headers) {
                    long previous = selectLong(conn, "SELECT size FROM mail_headers WHERE uid = ?", h.uid());
                    try (PreparedStatement ps = conn.prepareStatement(
                            "MERGE INTO mail_headers (uid, subject, from_addr, to_addr, sent_at, size, flags, folder, cached_at) "
                                    + "KEY (uid) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                        ps.setLong(1, h.uid());
                        ps.setString(2, nullToEmpty(h.subject()));
                        ps.setString(3, nullToEmpty(h.from()));
                        ps.setString(4, nullToEmpty(h.to()));
                        ps.setLong(5, h.date() == null ? now : h.date().toEpochMilli());
                        ps.setLong(6, h.sizeBytes());
                        ps.setString(7, writeFlags(h.flags()));
                        ps.setString(8, h.folder() == null ? "INBOX" : h.folder());
                        ps.setLong(9, now);
                        ps.executeUpdate();
                    }
                    d += h.sizeBytes() - previous;
                }
                return d;
            });
            budget.add(delta);
            log.debug("Cached {} mail headers ({} bytes delta)", headers.size(), delta);
            evictUntilWithinBudget();
        } finally {
            mutationLock.unlock();
        }
    }

    /** Upserts the body and replaces the attachments of its uid, then enforces the budget. */
    public void storeBody(MailBody body) {
        Objects.requireNonNull(body, "body");
        long now = clock.millis();
        mutationLock.lock();
        try {
            long delta = index.inTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "MERGE INTO mail_bodies (uid, content, content_type, cached_at) KEY (uid) VALUES (?, ?, ?, ?)")) {
                    ps.setLong(1, body.uid());
                    ps.setString(2, nullToEmpty(body.content()));
                    ps.setString(3, body.contentType() == null ? "text/plain" : body.contentType());
                    ps.setLong(4, now);
                    ps.executeUpdate();
                }
                long previous = selectLong(conn, "SELECT COALESCE(SUM(size), 0) FROM mail_attachments WHERE uid = ?", body.uid());
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM mail_attachments WHERE uid = ?")) {
                    ps.setLong(1, body.uid());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO mail_attachments (uid, filename, content_type, size, data, cached_at) VALUES (?, ?, ?, ?, ?, ?)")) {
                    for (MailAttachment a : body.attachments()) {
                        ps.setLong(1, body.uid());
                        ps.setString(2, a.filename());
                        ps.setString(3, a.contentType() == null ? "application/octet-stream" : a.contentType());
                        ps.setLong(4, a.sizeBytes());
                        ps.setBytes(5, a.data());
                        ps.setLong(6, now);
                        ps.addBatch();
                    }
                    if (!body.attachments().isEmpty()) ps.executeBatch();
                }
                return body.attachmentBytes() - previous;
            });
            budget.add(delta);
            log.debug("Cached body of message {} ({} attachments)", body.uid(), body.attachments().size());
            evictUntilWithinBudget();
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<MailBody> getBody(long uid) {
        return index.query(conn -> {
            String content;
            String contentType;
            try (PreparedStatement ps = conn.prepareStatement("SELECT content, content_type FROM mail_bodies WHERE uid = ?")) {
                ps.setLong(1, uid);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.<MailBody>empty();
                    content = rs.getString("content");
                    contentType = rs.getString("content_type");
                }
            }
            List<MailAttachment> attachments = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT filename, content_type, size, data FROM mail_attachments WHERE uid = ? ORDER BY id")) {
                ps.setLong(1, uid);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        attachments.add(new MailAttachment(rs.getString("filename"), rs.getString("content_type"),
                                rs.getLong("size"), rs.getBytes("data")));
                    }
                }
            }
            return Optional.of(new MailBody(uid, content, contentType, attachments));
        });
    }

    public Optional<MailHeader> getHeader(long uid) {
        List<MailHeader> found = headers(SELECT_HEADERS + " WHERE uid = ?", ps -> ps.setLong(1, uid));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /** Case-insensitive match on subject, sender or recipients, newest first. */
    public List<MailHeader> searchHeaders(String query) {
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return headers(SELECT_HEADERS + " ORDER BY sent_at DESC, uid DESC", ps -> { });
        }
        String like = "%" + q.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        return headers(SELECT_HEADERS
                + " WHERE LOWER(subject) LIKE ? ESCAPE '\\' OR LOWER(from_addr) LIKE ? ESCAPE '\\' OR LOWER(to_addr) LIKE ? ESCAPE '\\'"
                + " ORDER BY sent_at DESC, uid DESC", ps -> {
            ps.setString(1, like);
            ps.setString(2, like);
            ps.setString(3, like);
        });
    }

    public boolean remove(long uid) {
        mutationLock.lock();
        try {
            long size = messageSize(uid);
            boolean removed = deleteMessage(uid);
            if (removed) budget.release(size);
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    public int clear() {
        mutationLock.lock();
        try {
            int removed = index.inTransaction(conn -> {
                int n;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM mail_headers")) {
                    n = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM mail_bodies")) {
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM mail_attachments")) {
                    ps.executeUpdate();
                }
                return n;
            });
            budget.reset(0L);
            log.info("Cleared {} cached mail headers", removed);
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    /** Resyncs the counter from the rows, then evicts oldest-cached messages until within budget. */
    public CleanupResult cleanup() {
        mutationLock.lock();
        try {
            budget.reset(sumOfMessageSizes());
            long before = budget.used();
            int evicted = evictUntilWithinBudget();
            return new CleanupResult(0, evicted, before - budget.used(), budget.used());
        } finally {
            mutationLock.unlock();
        }
    }

    public long sizeBytes() {
        return budget.used();
    }

    public long maxSizeBytes() {
        return budget.maxBytes();
    }

    public long count() {
        return index.count("mail_headers");
    }

    // ---------------------------------------------------------------------------------------

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    // Caller holds mutationLock.
    private int evictUntilWithinBudget() {
        if (!budget.isOverBudget()) return 0;
        List<Long> oldestFirst = index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT uid, MIN(cached_at) AS first_cached FROM ("
                            + "SELECT uid, cached_at FROM mail_headers UNION ALL SELECT uid, cached_at FROM mail_bodies"
                            + ") AS cached GROUP BY uid ORDER BY first_cached ASC, uid ASC");
                 ResultSet rs = ps.executeQuery()) {
                List<Long> out = new ArrayList<>();
                while (rs.next()) out.add(rs.getLong("uid"));
                return out;
            }
        });
        int evicted = 0;
        long freed = 0L;
        for (long uid : oldestFirst) {
            if (!budget.isOverBudget()) break;
            try {
                long size = messageSize(uid);
                deleteMessage(uid);
                budget.release(size);
                freed += size;
                evicted++;
            } catch (StorageIoException e) {
                log.warn("Failed to evict cached message {}", uid, e);
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} cached messages ({} bytes), {} bytes in use", evicted, freed, budget.used());
        }
        return evicted;
    }

    private long messageSize(long uid) {
        return index.query(conn ->
                selectLong(conn, "SELECT COALESCE(SUM(size), 0) FROM mail_headers WHERE uid = ?", uid)
                        + selectLong(conn, "SELECT COALESCE(SUM(size), 0) FROM mail_attachments WHERE uid = ?", uid));
    }

    private boolean deleteMessage(long uid) {
        return index.inTransaction(conn -> {
            int rows = 0;
            for (String table : List.of("mail_headers", "mail_bodies", "mail_attachments")) {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE uid = ?")) {
                    ps.setLong(1, uid);
                    rows += ps.executeUpdate();
                }
            }
            return rows > 0;
        });
    }

    private long sumOfMessageSizes() {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(MESSAGE_SIZES);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    private List<MailHeader> headers(String sql, Binder binder) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                binder.bind(ps);
                List<MailHeader> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new MailHeader(
                                rs.getLong("uid"),
                                rs.getString("subject"),
                                rs.getString("from_addr"),
                                rs.getString("to_addr"),
                                Instant.ofEpochMilli(rs.getLong("sent_at")),
                                rs.getLong("size"),
                                readFlags(rs.getString("flags")),
                                rs.getString("folder")));
                    }
                }
                return out;
            }
        });
    }

    /** Returns 0 when the row is absent. */
    private static long selectLong(Connection conn, String sql, long uid) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, uid);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private String writeFlags(List<String> flags) {
        try {
            return mapper.writeValueAsString(flags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mail flags", e);
        }
    }

    private List<String> readFlags(String json) {
        try {
            return mapper.readValue(json, FLAGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageIoException("Corrupt flags column: " + json, e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
