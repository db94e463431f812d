package org.crynn.storage.history;

import java.time.Instant;

public record HistoryItem(
        String url,
        String title,
        int visitCount,
        Instant lastVisit,
        Instant createdAt
) {}
