package org.crynn.storage.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic blob names for cache keys.
 * <p>
 * A blob lives at {@code <cacheDir>/<first two hex chars>/<sha256>.bin}, so the file for a key
 * can always be located without separate path bookkeeping.
 */
public final class BlobNames {
    private BlobNames() {}

    public static String blobId(String key) {
        return sha256Hex(key);
    }

    /** Relative file reference, e.g. {@code ab/ab12...ef.bin}. */
    public static String fileRef(String key) {
        String id = blobId(key);
        return id.substring(0, 2) + "/" + id + ".bin";
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
