package org.crynn.storage.cache;

/**
 * Outcome of one cleanup pass over a bounded cache.
 *
 * @param expiredRemoved entries dropped because their expiry passed
 * @param evicted        entries dropped to get back under the size budget
 * @param bytesFreed     recorded size of everything removed
 * @param remainingBytes aggregate size after the pass
 */
public record CleanupResult(int expiredRemoved, int evicted, long bytesFreed, long remainingBytes) {

    public int removed() {
        return expiredRemoved + evicted;
    }
}
