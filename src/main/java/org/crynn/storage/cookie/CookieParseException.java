package org.crynn.storage.cookie;

import org.crynn.storage.StorageException;

/**
 * A single {@code Set-Cookie} value was rejected. Only that cookie is dropped; the rest of the
 * response is unaffected.
 */
public class CookieParseException extends StorageException {
    public CookieParseException(String message) { super(message); }
    public CookieParseException(String message, Throwable cause) { super(message, cause); }
}
