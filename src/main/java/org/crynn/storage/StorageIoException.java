package org.crynn.storage;

/**
 * A disk or index read/write failed. Raised from per-operation calls ({@code put}, {@code get},
 * {@code set}); callers of a cache read should treat it as "not cached" and re-fetch.
 */
public class StorageIoException extends StorageException {
    public StorageIoException(String message, Throwable cause) { super(message, cause); }
    public StorageIoException(String message) { super(message); }
}
