// file: src/main/java/io/txtlite/storage/SnapshotStore.java
package io.txtlite.storage;

import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.error.PersistenceException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Write-back store: in-memory working set over periodic durable snapshots.
 * <p>
 * Responsibilities:
 *  - Maintain in-memory maps for domains, keys, documents and blobs.
 *    The working set is the source of truth for reads while running.
 *  - On mutation:
 *      1) Apply to memory under the store monitor.
 *      2) Move the activity clock (lastModifiedMillis).
 *  - On flush:
 *      1) Copy the working set under the same monitor (consistent image).
 *      2) Write the image through the Snapshotter outside the monitor,
 *         so writers only block for the copy, not the disk I/O.
 *  - On startup:
 *      1) Load the latest readable snapshot (if any) into memory.
 * <p>
 * Note:
 * Writes accepted after the last flush are lost on a crash. The loss window is
 * bounded by one compaction poll interval; this is an accepted trade-off.
 */
public class SnapshotStore implements TextStore, PersistenceEngine {
    private static final Logger log = Logger.getLogger(SnapshotStore.class.getName());

    private static final Comparator<Document> CREATION_ORDER =
            Comparator.comparingLong(Document::createdMillis).thenComparing(Document::id);

    private final Map<String, DomainRecord> domains = new ConcurrentHashMap<>();
    private final Map<String, DomainKey> keys = new ConcurrentHashMap<>();
    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> idsByDomain = new ConcurrentHashMap<>();
    private final Map<String, Blob> blobs = new ConcurrentHashMap<>();

    private final Snapshotter snaps;
    private final Clock clock;
    private final long keyRetentionMillis;

    // Only one flush writes at a time (compactor vs. shutdown hook).
    private final ReentrantLock flushLock = new ReentrantLock();

    private volatile long lastModifiedMillis;

    public SnapshotStore(Snapshotter snaps, Duration keyRetention, Clock clock) {
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(keyRetention, "keyRetention");
        if (keyRetention.isNegative() || keyRetention.isZero()) {
            throw new IllegalArgumentException("keyRetention must be positive, got: " + keyRetention);
        }
        this.keyRetentionMillis = keyRetention.toMillis();
        recover();
    }

    /**
     * Open (or create) a store rooted at {@code dir}.
     *
     * @throws PersistenceException if the directory or its snapshots cannot be used;
     *                              callers treat this as fatal
     */
    public static SnapshotStore open(Path dir, int snapshotsRetained, Duration keyRetention, Clock clock) {
        try {
            return new SnapshotStore(new FileSnapshotter(dir, snapshotsRetained), keyRetention, clock);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("cannot open store at " + dir, e);
        }
    }

    // ---------- domains ----------

    @Override
    public Optional<DomainRecord> domain(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(domains.get(name));
    }

    @Override
    public synchronized boolean insertDomain(DomainRecord record) {
        if (domains.putIfAbsent(record.name(), record) != null) {
            return false;
        }
        markModified();
        return true;
    }

    @Override
    public synchronized void updateDomain(DomainRecord record) {
        if (!domains.containsKey(record.name())) {
            throw new NotFoundException("domain does not exist: " + record.name());
        }
        domains.put(record.name(), record);
        markModified();
    }

    // ---------- keys ----------

    @Override
    public synchronized void putKey(DomainKey key) {
        keys.put(key.tokenHash(), key);
        markModified();
    }

    @Override
    public Optional<DomainKey> key(String tokenHash) {
        return tokenHash == null ? Optional.empty() : Optional.ofNullable(keys.get(tokenHash));
    }

    @Override
    public synchronized void touchKey(String tokenHash, long nowMillis) {
        keys.computeIfPresent(tokenHash, (h, k) -> k.touchedAt(nowMillis));
    }

    // ---------- documents ----------

    @Override
    public Optional<Document> document(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(documents.get(id));
    }

    @Override
    public synchronized Document computeDocument(String id, UnaryOperator<Document> remap) {
        Document existing = documents.get(id);
        Document next = remap.apply(existing);
        if (next == null || !next.id().equals(id)) {
            throw new IllegalStateException("remap must return a document with id " + id);
        }
        if (existing != null && !existing.domain().equals(next.domain())) {
            Set<String> old = idsByDomain.get(existing.domain());
            if (old != null) old.remove(id);
        }
        documents.put(id, next);
        index(next);
        markModified();
        return next;
    }

    @Override
    public List<Document> documents(String domain) {
        Set<String> ids = idsByDomain.get(domain);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Document> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Document d = documents.get(id);
            if (d != null && d.domain().equals(domain)) {
                out.add(d);
            }
        }
        out.sort(CREATION_ORDER);
        return out;
    }

    // ---------- blobs ----------

    @Override
    public synchronized boolean insertBlob(Blob blob) {
        if (blobs.putIfAbsent(blob.id(), blob) != null) {
            return false;
        }
        markModified();
        return true;
    }

    @Override
    public Optional<Blob> blob(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(blobs.get(id));
    }

    // ---------- persistence engine ----------

    @Override
    public long lastModifiedMillis() {
        return lastModifiedMillis;
    }

    @Override
    public String flush() {
        flushLock.lock();
        try {
            StoreImage image = image();
            String id = snaps.writeSnapshot(image);
            log.fine(() -> String.format("flushed %s (domains=%d keys=%d documents=%d blobs=%d)",
                    id, image.domains().size(), image.keys().size(),
                    image.documents().size(), image.blobs().size()));
            return id;
        } finally {
            flushLock.unlock();
        }
    }

    @Override
    public synchronized int evictExpiredKeys() {
        long cutoff = clock.millis() - keyRetentionMillis;
        int removed = 0;
        for (var it = keys.values().iterator(); it.hasNext(); ) {
            if (it.next().lastUsedMillis() < cutoff) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            markModified();
        }
        return removed;
    }

    /**
     * Consistent copy of the whole working set.
     * Taken under the store monitor, so no mutation is half-applied in it.
     */
    public synchronized StoreImage image() {
        List<Document> docs = new ArrayList<>(documents.values());
        docs.sort(CREATION_ORDER);
        return new StoreImage(
                lastModifiedMillis,
                List.copyOf(domains.values()),
                List.copyOf(keys.values()),
                docs,
                List.copyOf(blobs.values())
        );
    }

    // ---------- internals ----------

    /** Seed memory from the latest readable snapshot, if any. */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded == null || loaded.image() == null) {
            log.info("no snapshot found, starting with an empty store");
            return;
        }
        StoreImage image = loaded.image();
        for (DomainRecord d : image.domains()) domains.put(d.name(), d);
        for (DomainKey k : image.keys()) keys.put(k.tokenHash(), k);
        for (Document d : image.documents()) {
            documents.put(d.id(), d);
            index(d);
        }
        for (Blob b : image.blobs()) blobs.put(b.id(), b);
        lastModifiedMillis = image.lastModifiedMillis();
        log.info(String.format("loaded %s (domains=%d keys=%d documents=%d blobs=%d)",
                loaded.id(), domains.size(), keys.size(), documents.size(), blobs.size()));
    }

    private void index(Document d) {
        idsByDomain.computeIfAbsent(d.domain(), k -> ConcurrentHashMap.newKeySet()).add(d.id());
    }

    private void markModified() {
        lastModifiedMillis = clock.millis();
    }
}
