package org.crynn.storage.cache;

/**
 * A cache hit: the index row plus the blob content.
 */
public record CachedResource(CacheEntry entry, byte[] content) {

    public String contentType() {
        return entry.contentType();
    }
}
