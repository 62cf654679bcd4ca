// file: src/main/java/io/txtlite/storage/TextStore.java
package io.txtlite.storage;

import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Data contract of the working set used by the service layer.
 * <p>
 * Semantics:
 *  - Reads observe the in-memory working set (source of truth while running).
 *  - Every mutation is serialized against a concurrent flush, so a snapshot
 *    never sees a torn write.
 *  - Mutations are NOT durable until the next {@link PersistenceEngine#flush()}.
 */
public interface TextStore {

    // ---------- domains ----------

    Optional<DomainRecord> domain(String name);

    /**
     * Insert a domain if its name is not taken.
     *
     * @return true if inserted, false if a domain with that name already exists
     */
    boolean insertDomain(DomainRecord record);

    /** Replace an existing domain record. Unknown names are rejected. */
    void updateDomain(DomainRecord record);

    // ---------- keys ----------

    void putKey(DomainKey key);

    Optional<DomainKey> key(String tokenHash);

    /**
     * Refresh lastUsed of a key. Bookkeeping only: does not move the
     * activity clock.
     */
    void touchKey(String tokenHash, long nowMillis);

    // ---------- documents ----------

    Optional<Document> document(String id);

    /**
     * Atomically compute a new value for a document id.
     * The remapping function receives null when the id is absent and must
     * return a non-null document carrying the same id.
     */
    Document computeDocument(String id, UnaryOperator<Document> remap);

    /** All documents of a domain in creation order (createdMillis, then id). */
    List<Document> documents(String domain);

    // ---------- blobs ----------

    /**
     * Insert a blob unless its id is already present.
     *
     * @return true if inserted, false if the id was already stored
     */
    boolean insertBlob(Blob blob);

    Optional<Blob> blob(String id);
}
