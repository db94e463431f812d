package org.crynn.storage;

import org.crynn.storage.cache.CleanupResult;

import java.util.Map;

/**
 * Outcome of {@link StorageManager#cleanup()}. A store whose pass failed has a {@code null}
 * result (or {@code -1} count) and an entry in {@code failures}.
 */
public record CleanupReport(
        CleanupResult cache,
        int historyRemoved,
        int cookiesRemoved,
        CleanupResult mail,
        Map<BrowsingDataKind, String> failures
) {
    public CleanupReport {
        failures = Map.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
