package org.crynn.storage.cookie;

import java.time.Instant;

/**
 * A stored cookie. Identity is (name, domain, path).
 * <p>
 * A domain with a leading dot came from a {@code Domain} attribute and also applies to
 * subdomains; a bare domain is host-only.
 */
public record Cookie(
        String name,
        String value,
        String domain,
        String path,
        Instant expiresAt,
        boolean secure,
        boolean httpOnly,
        SameSite sameSite,
        Instant createdAt,
        Instant lastAccessed
) {

    public boolean isSession() {
        return expiresAt == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean isHostOnly() {
        return !domain.startsWith(".");
    }

    public boolean matchesHost(String host) {
        if (isHostOnly()) return domain.equals(host);
        String bare = domain.substring(1);
        return host.equals(bare) || host.endsWith(domain);
    }

    public boolean matchesPath(String requestPath) {
        return requestPath.startsWith(path);
    }

    /** {@code name=value}, as sent in a {@code Cookie} request header. */
    public String pair() {
        return name + "=" + value;
    }
}
