// file: server/src/main/java/io/txtlite/server/docs/BlobService.java
package io.txtlite.server.docs;

import io.txtlite.core.Blob;
import io.txtlite.core.ContentHash;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.error.PersistenceException;
import io.txtlite.core.error.ValidationException;
import io.txtlite.storage.TextStore;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content-addressed attachment storage.
 * <p>
 * Blob ids are "sha256-" + hex digest of the uncompressed bytes. Bytes are
 * kept gzip-compressed. Re-inserting an existing id is a no-op.
 */
public class BlobService {
    private static final Logger log = Logger.getLogger(BlobService.class.getName());

    private final TextStore store;
    private final Clock clock;

    public BlobService(TextStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Derive the id from the content and store it.
     *
     * @return blob id
     */
    public String store(String filename, byte[] content) {
        Objects.requireNonNull(content, "content");
        String id = ContentHash.blobId(content);
        put(id, filename, content);
        return id;
    }

    /**
     * Insert unless the id is already present.
     *
     * @throws ValidationException when id does not match the content digest
     */
    public void put(String id, String filename, byte[] content) {
        Objects.requireNonNull(content, "content");
        if (id == null || id.isBlank()) {
            throw new ValidationException("blob id must not be empty");
        }
        if (!id.equals(ContentHash.blobId(content))) {
            throw new ValidationException("blob id does not match content: " + id);
        }
        if (store.blob(id).isPresent()) {
            log.fine(() -> "blob " + id + " already stored");
            return;
        }
        byte[] compressed = gzip(content);
        if (store.insertBlob(new Blob(id, filename, compressed, clock.millis()))) {
            log.fine(() -> "stored blob " + id + " (" + content.length + " -> " + compressed.length + " bytes)");
        }
    }

    /** @throws NotFoundException unknown id */
    public Attachment get(String id) {
        Blob blob = getCompressed(id);
        return new Attachment(blob.filename(), gunzip(blob));
    }

    /** Stored form, for serving with Content-Encoding: gzip. */
    public Blob getCompressed(String id) {
        return store.blob(id)
                .orElseThrow(() -> new NotFoundException("blob does not exist: " + id));
    }

    // ---------- helpers ----------

    private static byte[] gzip(byte[] raw) {
        var out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
        try (var gz = new GZIPOutputStream(out)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new PersistenceException("failed to compress blob", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(Blob blob) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(blob.compressed()))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new PersistenceException("stored blob is corrupt: " + blob.id(), e);
        }
    }
}
