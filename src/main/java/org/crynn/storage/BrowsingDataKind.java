package org.crynn.storage;

/** Categories of stored data a user can wipe in one action. */
public enum BrowsingDataKind {
    CACHE,
    COOKIES,
    HISTORY,
    BOOKMARKS,
    MAIL
}
