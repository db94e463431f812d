package org.crynn.storage.cookie;

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
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Cookie storage with the browser's security policy applied on write and on read.
 *
 * <ul>
 *   <li>Writes are upserts on (name, domain, path).</li>
 *   <li>Cookies set over https are stored as secure when {@link CookiePolicy#upgradeSecureOnTls()} is on.</li>
 *   <li>Secure cookies are never returned for a plain-http request.</li>
 * </ul>
 */
public class CookieJar {
    private static final Logger log = LoggerFactory.getLogger(CookieJar.class);

    private static final String SELECT_COLUMNS =
            "SELECT id, name, cookie_value, domain, path, expires_at, secure, http_only, same_site, created_at, last_accessed FROM cookies";

    private final StorageIndex index;
    private final CookiePolicy policy;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public CookieJar(StorageIndex index, CookiePolicy policy, Clock clock) {
        this.index = Objects.requireNonNull(index, "index");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores one {@code Set-Cookie} value received for {@code requestUrl}.
     *
     * @return the stored cookie, or empty when the cookie was already expired (which deletes any
     * stored cookie with the same name, domain and path)
     * @throws CookieParseException if the value is malformed or its Domain does not cover the request host
     */
    public Optional<Cookie> set(String rawHeader, String requestUrl) {
        RequestUrl request;
        try {
            request = RequestUrl.parse(requestUrl);
        } catch (IllegalArgumentException e) {
            throw new CookieParseException("Cannot scope cookie to request url " + requestUrl, e);
        }
        SetCookieParser.SetCookie parsed = SetCookieParser.parse(rawHeader);
        Instant now = clock.instant();
        Cookie cookie = toCookie(parsed, request, now);

        writeLock.lock();
        try {
            if (cookie.isExpired(now)) {
                boolean removed = remove(cookie.name(), cookie.domain(), cookie.path());
                log.debug("Cookie {} for {}{} arrived expired (removed existing={})",
                        cookie.name(), cookie.domain(), cookie.path(), removed);
                return Optional.empty();
            }
            index.inTransaction(conn -> {
                if (update(conn, cookie) == 0) {
                    insert(conn, cookie);
                }
                return null;
            });
        } finally {
            writeLock.unlock();
        }
        log.debug("Stored cookie {} for {}{} (secure={}, sameSite={})",
                cookie.name(), cookie.domain(), cookie.path(), cookie.secure(), cookie.sameSite());
        return Optional.of(cookie);
    }

    /**
     * Applies every {@code Set-Cookie} value of one response. Malformed values are logged and
     * skipped. Returns how many were accepted.
     */
    public int setAll(Collection<String> rawHeaders, String requestUrl) {
        int accepted = 0;
        for (String raw : rawHeaders) {
            try {
                set(raw, requestUrl);
                accepted++;
            } catch (CookieParseException e) {
                log.warn("Dropping cookie from {}: {}", requestUrl, e.getMessage());
            }
        }
        return accepted;
    }

    /** {@code name=value} pairs to send with a request to {@code requestUrl}. */
    public List<String> get(String requestUrl) {
        return get(requestUrl, true);
    }

    /**
     * Cookies that apply to {@code requestUrl}: domain and path match, not expired, and not
     * secure unless the request is. Pass {@code includeHttpOnly=false} for script access.
     * Longer paths come first, then older cookies. Touches {@code last_accessed} of each result.
     */
    public List<String> get(String requestUrl, boolean includeHttpOnly) {
        RequestUrl request = RequestUrl.parse(requestUrl);
        Instant now = clock.instant();
        List<String> domains = request.candidateDomains();

        List<StoredCookie> matching = index.query(conn -> {
            String placeholders = domains.stream().map(d -> "?").collect(Collectors.joining(", "));
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS
                    + " WHERE domain IN (" + placeholders + ") AND (expires_at IS NULL OR expires_at >= ?)")) {
                int i = 1;
                for (String d : domains) ps.setString(i++, d);
                ps.setLong(i, now.toEpochMilli());
                List<StoredCookie> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
                return out;
            }
        });

        List<StoredCookie> result = new ArrayList<>();
        for (StoredCookie sc : matching) {
            Cookie c = sc.cookie();
            if (!c.matchesHost(request.host()) || !c.matchesPath(request.path())) continue;
            if (c.secure() && !request.isSecure()) {
                log.debug("Omitting secure cookie {} from insecure request to {}", c.name(), request.host());
                continue;
            }
            if (c.httpOnly() && !includeHttpOnly) continue;
            result.add(sc);
        }
        result.sort(Comparator.comparingInt((StoredCookie sc) -> sc.cookie().path().length()).reversed()
                .thenComparing(sc -> sc.cookie().createdAt())
                .thenComparingLong(StoredCookie::id));

        if (!result.isEmpty()) {
            touch(result, now);
        }
        return result.stream().map(sc -> sc.cookie().pair()).toList();
    }

    public Optional<Cookie> find(String name, String domain, String path) {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " WHERE name = ? AND domain = ? AND path = ?")) {
                ps.setString(1, name);
                ps.setString(2, domain);
                ps.setString(3, path);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs).cookie()) : Optional.<Cookie>empty();
                }
            }
        });
    }

    /** Every stored cookie, expired ones included, in insertion order. */
    public List<Cookie> list() {
        return index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_COLUMNS + " ORDER BY id");
                 ResultSet rs = ps.executeQuery()) {
                List<Cookie> out = new ArrayList<>();
                while (rs.next()) out.add(map(rs).cookie());
                return out;
            }
        });
    }

    public boolean remove(String name, String domain, String path) {
        writeLock.lock();
        try {
            return index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM cookies WHERE name = ? AND domain = ? AND path = ?")) {
                    ps.setString(1, name);
                    ps.setString(2, domain);
                    ps.setString(3, path);
                    return ps.executeUpdate() > 0;
                }
            });
        } finally {
            writeLock.unlock();
        }
    }

    /** Deletes cookies whose expiry is strictly in the past. Session cookies stay. */
    public int cleanup() {
        long now = clock.millis();
        writeLock.lock();
        try {
            int removed = index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM cookies WHERE expires_at IS NOT NULL AND expires_at < ?")) {
                    ps.setLong(1, now);
                    return ps.executeUpdate();
                }
            });
            if (removed > 0) {
                log.info("Cookie cleanup removed {} expired cookies", removed);
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public int clear() {
        writeLock.lock();
        try {
            int removed = index.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM cookies")) {
                    return ps.executeUpdate();
                }
            });
            log.info("Cleared {} cookies", removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public long count() {
        return index.count("cookies");
    }

    public CookiePolicy policy() {
        return policy;
    }

    // ---------------------------------------------------------------------------------------

    private record StoredCookie(long id, Cookie cookie) {}

    private Cookie toCookie(SetCookieParser.SetCookie parsed, RequestUrl request, Instant now) {
        String domain;
        if (parsed.domain() == null) {
            domain = request.host();
        } else {
            String d = parsed.domain();
            if (!request.host().equals(d) && !request.host().endsWith("." + d)) {
                throw new CookieParseException("Cookie " + parsed.name() + " sets Domain=" + d
                        + " which does not cover request host " + request.host());
            }
            domain = "." + d;
        }
        String path = parsed.path() == null ? request.path() : parsed.path();
        return new Cookie(
                parsed.name(),
                parsed.value(),
                domain,
                path,
                parsed.expiresAt(now),
                policy.effectiveSecure(parsed.secure(), request),
                parsed.httpOnly(),
                policy.effectiveSameSite(parsed.sameSite()),
                now,
                now
        );
    }

    private static int update(Connection conn, Cookie c) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE cookies SET cookie_value = ?, expires_at = ?, secure = ?, http_only = ?, same_site = ?, last_accessed = ? "
                        + "WHERE name = ? AND domain = ? AND path = ?")) {
            ps.setString(1, c.value());
            StorageIndex.setNullableLong(ps, 2, c.expiresAt() == null ? null : c.expiresAt().toEpochMilli());
            ps.setBoolean(3, c.secure());
            ps.setBoolean(4, c.httpOnly());
            ps.setString(5, c.sameSite().name());
            ps.setLong(6, c.lastAccessed().toEpochMilli());
            ps.setString(7, c.name());
            ps.setString(8, c.domain());
            ps.setString(9, c.path());
            return ps.executeUpdate();
        }
    }

    private static void insert(Connection conn, Cookie c) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO cookies (name, cookie_value, domain, path, expires_at, secure, http_only, same_site, created_at, last_accessed) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, c.name());
            ps.setString(2, c.value());
            ps.setString(3, c.domain());
            ps.setString(4, c.path());
            StorageIndex.setNullableLong(ps, 5, c.expiresAt() == null ? null : c.expiresAt().toEpochMilli());
            ps.setBoolean(6, c.secure());
            ps.setBoolean(7, c.httpOnly());
            ps.setString(8, c.sameSite().name());
            ps.setLong(9, c.createdAt().toEpochMilli());
            ps.setLong(10, c.lastAccessed().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private void touch(List<StoredCookie> cookies, Instant now) {
        String placeholders = cookies.stream().map(c -> "?").collect(Collectors.joining(", "));
        index.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE cookies SET last_accessed = ? WHERE id IN (" + placeholders + ")")) {
                ps.setLong(1, now.toEpochMilli());
                int i = 2;
                for (StoredCookie c : cookies) ps.setLong(i++, c.id());
                return ps.executeUpdate();
            }
        });
    }

    private static StoredCookie map(ResultSet rs) throws SQLException {
        Long expires = StorageIndex.nullableLong(rs, "expires_at");
        Cookie c = new Cookie(
                rs.getString("name"),
                rs.getString("cookie_value"),
                rs.getString("domain"),
                rs.getString("path"),
                expires == null ? null : Instant.ofEpochMilli(expires),
                rs.getBoolean("secure"),
                rs.getBoolean("http_only"),
                SameSite.valueOf(rs.getString("same_site")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("last_accessed"))
        );
        return new StoredCookie(rs.getLong("id"), c);
    }
}
