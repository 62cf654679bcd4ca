// file: src/main/java/io/txtlite/core/ContentHash.java
package io.txtlite.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for blob ids and key digests.
 */
public final class ContentHash {
    public static final String BLOB_ID_PREFIX = "sha256-";

    private ContentHash() {
        // utility
    }

    /** Content-derived blob id: "sha256-" + lower-case hex digest. */
    public static String blobId(byte[] content) {
        return BLOB_ID_PREFIX + HexFormat.of().formatHex(sha256(content));
    }

    public static String sha256Hex(String s) {
        return HexFormat.of().formatHex(sha256(s.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
