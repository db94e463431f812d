package org.crynn.storage.index;

import org.crynn.storage.StorageException;

/**
 * Index bootstrap or migration failed. Fatal: storage initialization is aborted.
 */
public class SchemaException extends StorageException {
    public SchemaException(String message, Throwable cause) { super(message, cause); }
    public SchemaException(String message) { super(message); }
}
