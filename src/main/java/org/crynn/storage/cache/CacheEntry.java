package org.crynn.storage.cache;

import java.time.Instant;

/**
 * Index row for one cached resource. {@code fileRef} is the blob path relative to the cache directory.
 */
public record CacheEntry(
        String key,
        String contentType,
        long sizeBytes,
        Instant createdAt,
        Instant accessedAt,
        Instant expiresAt,
        String fileRef
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    CacheEntry withAccessedAt(Instant accessed) {
        return new CacheEntry(key, contentType, sizeBytes, createdAt, accessed, expiresAt, fileRef);
    }
}
