package org.crynn.storage.bookmark;

import java.time.Instant;

public record Bookmark(String url, String title, String folder, Instant createdAt) {}
