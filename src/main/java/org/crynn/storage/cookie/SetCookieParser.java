package org.crynn.storage.cookie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parses one {@code Set-Cookie} value: {@code name=value; Attr=Val; Flag; ...}.
 * <p>
 * Only syntax is handled here. Defaults that depend on the request (domain, path, secure
 * upgrade) are applied by {@link CookieJar}.
 */
public final class SetCookieParser {
    private static final Logger log = LoggerFactory.getLogger(SetCookieParser.class);

    private static final List<DateTimeFormatter> EXPIRES_FORMATS = List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ofPattern("EEE, dd-MMM-yyyy HH:mm:ss zzz", Locale.US),
            DateTimeFormatter.ofPattern("EEE, dd-MMM-yy HH:mm:ss zzz", Locale.US)
    );

    /** Longest lifetime a cookie may ask for; later Max-Age or Expires values are clamped to it. */
    public static final Duration MAX_LIFETIME = Duration.ofDays(400);

    private SetCookieParser() {}

    /**
     * Attributes as the server sent them. {@code domain}, {@code path}, {@code expires},
     * {@code maxAgeSeconds} and {@code sameSite} are {@code null} when absent or unparseable.
     */
    public record SetCookie(
            String name,
            String value,
            String domain,
            String path,
            Instant expires,
            Long maxAgeSeconds,
            boolean secure,
            boolean httpOnly,
            SameSite sameSite
    ) {
        /**
         * Max-Age wins over Expires; {@code null} means a session cookie. Never later than
         * {@code now + MAX_LIFETIME}.
         */
        public Instant expiresAt(Instant now) {
            Instant latest = now.plus(MAX_LIFETIME);
            if (maxAgeSeconds != null) {
                if (maxAgeSeconds <= 0) return Instant.EPOCH;
                return maxAgeSeconds >= MAX_LIFETIME.getSeconds() ? latest : now.plusSeconds(maxAgeSeconds);
            }
            if (expires != null && expires.isAfter(latest)) return latest;
            return expires;
        }
    }

    public static SetCookie parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CookieParseException("Set-Cookie value is blank");
        }
        String[] parts = raw.split(";");
        String pair = parts[0];
        int eq = pair.indexOf('=');
        if (eq < 0) {
            throw new CookieParseException("Set-Cookie value has no name=value pair: " + abbreviate(raw));
        }
        String name = pair.substring(0, eq).trim();
        String value = pair.substring(eq + 1).trim();
        if (name.isEmpty()) {
            throw new CookieParseException("Set-Cookie value has an empty name: " + abbreviate(raw));
        }

        String domain = null;
        String path = null;
        Instant expires = null;
        Long maxAge = null;
        boolean secure = false;
        boolean httpOnly = false;
        SameSite sameSite = null;

        for (int i = 1; i < parts.length; i++) {
            String attr = parts[i].trim();
            if (attr.isEmpty()) continue;
            int aeq = attr.indexOf('=');
            String attrName = (aeq < 0 ? attr : attr.substring(0, aeq)).trim().toLowerCase(Locale.ROOT);
            String attrValue = aeq < 0 ? "" : attr.substring(aeq + 1).trim();

            switch (attrName) {
                case "domain" -> {
                    String d = attrValue.startsWith(".") ? attrValue.substring(1) : attrValue;
                    domain = d.isEmpty() ? null : d.toLowerCase(Locale.ROOT);
                }
                case "path" -> path = attrValue.startsWith("/") ? attrValue : null;
                case "expires" -> expires = parseExpires(attrValue);
                case "max-age" -> maxAge = parseMaxAge(attrValue);
                case "secure" -> secure = true;
                case "httponly" -> httpOnly = true;
                case "samesite" -> sameSite = SameSite.parse(attrValue).orElse(null);
                default -> log.debug("Ignoring unknown cookie attribute '{}' on {}", attrName, name);
            }
        }
        return new SetCookie(name, value, domain, path, expires, maxAge, secure, httpOnly, sameSite);
    }

    static Instant parseExpires(String raw) {
        DateTimeParseException last = null;
        for (DateTimeFormatter f : EXPIRES_FORMATS) {
            try {
                return ZonedDateTime.parse(raw, f).toInstant();
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("Ignoring unparseable Expires '{}'", raw, last);
        return null;
    }

    private static Long parseMaxAge(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Max-Age '{}'", raw);
            return null;
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 64 ? s : s.substring(0, 64) + "...";
    }
}
