package org.crynn.storage.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate size counter for a bounded cache.
 * <p>
 * Updated with atomic increments on the write path; callers hold their store's mutation lock
 * while changing it, and the eviction pass resynchronises it from actual row sizes.
 */
public final class SizeBudget {

    private final AtomicLong used = new AtomicLong();
    private volatile long maxBytes;

    public SizeBudget(long maxBytes) {
        setMaxBytes(maxBytes);
    }

    public long add(long delta) {
        return used.updateAndGet(v -> Math.max(0L, v + delta));
    }

    public long release(long bytes) {
        return add(-bytes);
    }

    public void reset(long actualBytes) {
        used.set(Math.max(0L, actualBytes));
    }

    public long used() {
        return used.get();
    }

    public long maxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        if (maxBytes <= 0L) {
            throw new IllegalArgumentException("maxBytes must be > 0, got " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    public boolean isOverBudget() {
        return used.get() > maxBytes;
    }
}
