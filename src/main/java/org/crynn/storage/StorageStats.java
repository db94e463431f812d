package org.crynn.storage;

/**
 * Point-in-time totals across all stores.
 *
 * @param totalBytes on-disk footprint: the index database file plus everything under the cache directory
 */
public record StorageStats(
        long cacheSizeBytes,
        long cacheEntries,
        long historyItems,
        long bookmarks,
        long cookies,
        long mailCacheBytes,
        long totalBytes
) {}
