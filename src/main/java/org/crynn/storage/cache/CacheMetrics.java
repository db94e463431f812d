package org.crynn.storage.cache;

public interface CacheMetrics {
    long hits();
    long misses();
    long bytesUsed();
}
