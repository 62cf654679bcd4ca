// file: src/main/java/io/txtlite/storage/SnapshotCodec.java
package io.txtlite.storage;

import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.PersistenceException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for snapshot files.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, big-endian)]
 *     - magic   (2B)  = 0x7E57   (helps detect garbage)
 *     - version (1B)  = 1
 *     - length  (4B)  = body length in bytes
 *     - crc32   (4B)  = CRC32(body)
 * <p>
 *   [BODY]
 *     - lastModified: int64
 *     - domains: int32 count, then per domain
 *         name (string), passwordHash (nullable string), isPublic (bool), created (int64)
 *     - keys: int32 count, then per key
 *         tokenHash, domain (strings), issued, lastUsed (int64)
 *     - documents: int32 count, then per document
 *         id, domain, slug, content (strings), created, modified, views (int64),
 *         similar: int32 count + strings
 *     - blobs: int32 count, then per blob
 *         id, filename (strings), created (int64), payload (bytes)
 * <p>
 * Strings are int32 len + UTF-8 bytes (len == -1 => null); byte arrays the same.
 */
final class SnapshotCodec {
    static final short MAGIC = (short) 0x7E57;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private SnapshotCodec() {
        // utility
    }

    /** Encode an image into header+body bytes ready to be written to a file. */
    static byte[] encode(StoreImage image) {
        byte[] body;
        try {
            var bytes = new ByteArrayOutputStream(4096);
            var out = new DataOutputStream(bytes);
            out.writeLong(image.lastModifiedMillis());

            out.writeInt(image.domains().size());
            for (DomainRecord d : image.domains()) {
                writeString(out, d.name());
                writeString(out, d.passwordHash());
                out.writeBoolean(d.isPublic());
                out.writeLong(d.createdMillis());
            }

            out.writeInt(image.keys().size());
            for (DomainKey k : image.keys()) {
                writeString(out, k.tokenHash());
                writeString(out, k.domain());
                out.writeLong(k.issuedMillis());
                out.writeLong(k.lastUsedMillis());
            }

            out.writeInt(image.documents().size());
            for (Document doc : image.documents()) {
                writeString(out, doc.id());
                writeString(out, doc.domain());
                writeString(out, doc.slug());
                writeString(out, doc.content());
                out.writeLong(doc.createdMillis());
                out.writeLong(doc.modifiedMillis());
                out.writeLong(doc.views());
                out.writeInt(doc.similarIds().size());
                for (String s : doc.similarIds()) {
                    writeString(out, s);
                }
            }

            out.writeInt(image.blobs().size());
            for (Blob b : image.blobs()) {
                writeString(out, b.id());
                writeString(out, b.filename());
                out.writeLong(b.createdMillis());
                writeBytes(out, b.compressed());
            }
            out.flush();
            body = bytes.toByteArray();
        } catch (IOException e) {
            throw new PersistenceException("snapshot encode failed", e);
        }

        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
        header.putShort(MAGIC).put(VERSION).putInt(body.length).putInt(crc32(body));

        byte[] out = new byte[HEADER_BYTES + body.length];
        System.arraycopy(header.array(), 0, out, 0, HEADER_BYTES);
        System.arraycopy(body, 0, out, HEADER_BYTES, body.length);
        return out;
    }

    /**
     * Decode full file contents (header + body).
     *
     * @throws PersistenceException on bad magic/version, truncation or CRC mismatch
     */
    static StoreImage decode(byte[] file) {
        if (file.length < HEADER_BYTES) {
            throw new PersistenceException("snapshot truncated: " + file.length + " bytes");
        }
        ByteBuffer header = ByteBuffer.wrap(file, 0, HEADER_BYTES);
        short magic = header.getShort();
        byte ver = header.get();
        int len = header.getInt();
        int crc = header.getInt();
        if (magic != MAGIC) throw new PersistenceException("bad snapshot magic");
        if (ver != VERSION) throw new PersistenceException("unsupported snapshot version " + ver);
        if (len < 0 || HEADER_BYTES + len != file.length) {
            throw new PersistenceException("snapshot length mismatch");
        }
        byte[] body = new byte[len];
        System.arraycopy(file, HEADER_BYTES, body, 0, len);
        if (crc32(body) != crc) throw new PersistenceException("snapshot CRC mismatch");

        try (var in = new DataInputStream(new ByteArrayInputStream(body))) {
            long lastModified = in.readLong();

            int domainCount = in.readInt();
            List<DomainRecord> domains = new ArrayList<>(domainCount);
            for (int i = 0; i < domainCount; i++) {
                String name = readString(in);
                String hash = readString(in);
                boolean isPublic = in.readBoolean();
                long created = in.readLong();
                domains.add(new DomainRecord(name, hash, isPublic, created));
            }

            int keyCount = in.readInt();
            List<DomainKey> keys = new ArrayList<>(keyCount);
            for (int i = 0; i < keyCount; i++) {
                String tokenHash = readString(in);
                String domain = readString(in);
                long issued = in.readLong();
                long lastUsed = in.readLong();
                keys.add(new DomainKey(tokenHash, domain, issued, lastUsed));
            }

            int docCount = in.readInt();
            List<Document> docs = new ArrayList<>(docCount);
            for (int i = 0; i < docCount; i++) {
                String id = readString(in);
                String domain = readString(in);
                String slug = readString(in);
                String content = readString(in);
                long created = in.readLong();
                long modified = in.readLong();
                long views = in.readLong();
                int simCount = in.readInt();
                List<String> similar = new ArrayList<>(simCount);
                for (int s = 0; s < simCount; s++) {
                    similar.add(readString(in));
                }
                docs.add(new Document(id, domain, slug, content, created, modified, views, similar));
            }

            int blobCount = in.readInt();
            List<Blob> blobs = new ArrayList<>(blobCount);
            for (int i = 0; i < blobCount; i++) {
                String id = readString(in);
                String filename = readString(in);
                long created = in.readLong();
                byte[] payload = readBytes(in);
                blobs.add(new Blob(id, filename, payload == null ? new byte[0] : payload, created));
            }
            return new StoreImage(lastModified, domains, keys, docs, blobs);
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            throw new PersistenceException("snapshot body is malformed", e);
        }
    }

    // ----------------- helpers -----------------

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        writeBytes(out, s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    private static String readString(DataInputStream in) throws IOException {
        byte[] b = readBytes(in);
        return b == null ? null : new String(b, StandardCharsets.UTF_8);
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        if (v == null) {
            out.writeInt(-1);
            return;
        }
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len == -1) return null;
        if (len < 0) throw new IOException("negative length " + len);
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new IOException("truncated field");
        return b;
    }
}
