package org.crynn.storage.bookmark;

import org.crynn.storage.StorageException;

/**
 * Adding a bookmark would exceed the configured maximum. Bookmarks are never evicted to make room.
 */
public class BookmarkCapacityException extends StorageException {
    private final int maxBookmarks;

    public BookmarkCapacityException(int maxBookmarks) {
        super("Bookmark limit reached (" + maxBookmarks + ")");
        this.maxBookmarks = maxBookmarks;
    }

    public int maxBookmarks() { return maxBookmarks; }
}
