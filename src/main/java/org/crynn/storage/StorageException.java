package org.crynn.storage;

/**
 * Base type for failures raised by the local data store.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) { super(message, cause); }
    public StorageException(String message) { super(message); }
}
