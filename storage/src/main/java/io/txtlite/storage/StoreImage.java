// file: src/main/java/io/txtlite/storage/StoreImage.java
package io.txtlite.storage;

import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;

import java.util.List;

/**
 * Point-in-time copy of the whole working set, as written to and read from
 * a snapshot file.
 */
public record StoreImage(
        long lastModifiedMillis,
        List<DomainRecord> domains,
        List<DomainKey> keys,
        List<Document> documents,
        List<Blob> blobs
) {
    public StoreImage {
        domains = List.copyOf(domains);
        keys = List.copyOf(keys);
        documents = List.copyOf(documents);
        blobs = List.copyOf(blobs);
    }

    public static StoreImage empty() {
        return new StoreImage(0L, List.of(), List.of(), List.of(), List.of());
    }
}
