// file: src/main/java/io/txtlite/core/Blob.java
package io.txtlite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Content-addressed attachment.
 * <p>
 * Fields:
 *  - id:         derived from the SHA-256 of the uncompressed bytes ("sha256-<hex>").
 *  - filename:   original upload name.
 *  - compressed: gzip payload.
 * <p>
 * Defensive copies of the payload are taken on input and output.
 */
public final class Blob {
    private final String id;
    private final String filename;
    private final byte[] compressed;
    private final long createdMillis;

    public Blob(String id, String filename, byte[] compressed, long createdMillis) {
        this.id = Objects.requireNonNull(id, "id");
        this.filename = filename == null ? "" : filename;
        Objects.requireNonNull(compressed, "compressed");
        this.compressed = Arrays.copyOf(compressed, compressed.length);
        this.createdMillis = createdMillis;
    }

    public String id() { return id; }

    public String filename() { return filename; }

    public byte[] compressed() { return Arrays.copyOf(compressed, compressed.length); }

    public int compressedLength() { return compressed.length; }

    public long createdMillis() { return createdMillis; }
}
