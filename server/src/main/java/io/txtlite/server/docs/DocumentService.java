// file: server/src/main/java/io/txtlite/server/docs/DocumentService.java
package io.txtlite.server.docs;

import io.txtlite.core.Document;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.NoteContent;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.similarity.Tokenizer;
import io.txtlite.storage.TextStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for documents.
 *
 * Responsibilities:
 *  - Upsert documents by id, keeping creation time, views and the similarity
 *    cache across saves.
 *  - Normalize trivial content (whitespace, the empty-note placeholder) to "".
 *  - Slug lookups (slugs are not unique), recency/popularity lists and
 *    token search within a domain.
 *  - Fire-and-forget view counting on a background thread.
 */
public class DocumentService implements AutoCloseable {
    private static final Logger log = Logger.getLogger(DocumentService.class.getName());

    private static final Comparator<Document> MOST_RECENT_FIRST =
            Comparator.comparingLong(Document::modifiedMillis).reversed()
                    .thenComparing(Document::id);

    private static final Comparator<Document> MOST_VIEWED_FIRST =
            Comparator.comparingLong(Document::views).reversed()
                    .thenComparing(MOST_RECENT_FIRST);

    private final TextStore store;
    private final Clock clock;
    private final ExecutorService background;

    public DocumentService(TextStore store, Clock clock) {
        this(store, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "view-counter");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * @param background executor for view counting; owned (and shut down) by this service
     */
    public DocumentService(TextStore store, Clock clock, ExecutorService background) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.background = Objects.requireNonNull(background, "background");
    }

    /**
     * Upsert by id.
     * <p>
     * New documents take createdMillis from the argument (or now when unset).
     * Existing documents keep createdMillis and views; the similarity cache is
     * kept unless the document moved to another domain. modifiedMillis is
     * always set to now.
     *
     * @throws NotFoundException when the target domain is neither public nor registered
     */
    public Document save(Document doc) {
        Objects.requireNonNull(doc, "doc");
        String domain = DomainRecord.normalizeName(doc.domain());
        if (domain.isEmpty()) {
            domain = DomainRecord.PUBLIC;
        }
        requireWritable(domain);

        String targetDomain = domain;
        String content = NoteContent.normalize(doc.content());
        long now = clock.millis();

        Document saved = store.computeDocument(doc.id(), prev -> {
            if (prev == null) {
                long created = doc.createdMillis() > 0 ? doc.createdMillis() : now;
                return new Document(doc.id(), targetDomain, doc.slug(), content,
                        created, now, doc.views(), List.of());
            }
            List<String> similar = prev.domain().equals(targetDomain) ? prev.similarIds() : List.of();
            return new Document(doc.id(), targetDomain, doc.slug(), content,
                    prev.createdMillis(), now, prev.views(), similar);
        });
        log.fine(() -> "saved document " + saved.id() + " in " + saved.domain() + "/" + saved.slug());
        return saved;
    }

    /** Create and save an empty document under the given slug. */
    public Document createEmpty(String domain, String slug) {
        long now = clock.millis();
        return save(Document.empty(UUID.randomUUID().toString(), domain, slug, now));
    }

    /** New empty page whose slug is its own id. */
    public Document newPage(String domain) {
        String id = UUID.randomUUID().toString();
        return save(Document.empty(id, domain, id, clock.millis()));
    }

    public Optional<Document> find(String id) {
        return store.document(id);
    }

    /** All documents of the domain sharing this slug, in creation order. Possibly empty. */
    public List<Document> get(String slug, String domain) {
        String s = slug == null ? "" : slug;
        return store.documents(domainOrPublic(domain)).stream()
                .filter(d -> d.slug().equals(s))
                .toList();
    }

    public boolean exists(String slug, String domain) {
        return !get(slug, domain).isEmpty();
    }

    /** Every document of the domain in creation order. */
    public List<Document> getAll(String domain) {
        return store.documents(domainOrPublic(domain));
    }

    public List<Document> mostRecentlyModified(String domain, int limit) {
        return top(domain, MOST_RECENT_FIRST, limit);
    }

    public List<Document> mostViewed(String domain, int limit) {
        return top(domain, MOST_VIEWED_FIRST, limit);
    }

    /**
     * Documents whose slug+content tokens contain every query token, most
     * recently modified first. A query without tokens matches nothing.
     */
    public List<Document> search(String query, String domain) {
        Set<String> wanted = Tokenizer.tokenSet(query);
        if (wanted.isEmpty()) {
            return List.of();
        }
        List<Document> hits = new ArrayList<>();
        for (Document d : store.documents(domainOrPublic(domain))) {
            if (Tokenizer.tokenSet(d.slug() + " " + d.content()).containsAll(wanted)) {
                hits.add(d);
            }
        }
        hits.sort(MOST_RECENT_FIRST);
        return hits;
    }

    /**
     * Ids in the document's similarity cache that still resolve, in rank order.
     *
     * @throws NotFoundException unknown document id
     */
    public List<Document> similar(String documentId) {
        Document doc = store.document(documentId)
                .orElseThrow(() -> new NotFoundException("document does not exist: " + documentId));
        List<Document> out = new ArrayList<>(doc.similarIds().size());
        for (String id : doc.similarIds()) {
            store.document(id).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Count one view. Returns immediately; failures are logged and never
     * reach the caller.
     */
    public void incrementView(String documentId) {
        try {
            background.execute(() -> {
                try {
                    store.computeDocument(documentId, prev -> {
                        if (prev == null) {
                            throw new NotFoundException("document does not exist: " + documentId);
                        }
                        return prev.withViews(prev.views() + 1);
                    });
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "view count for " + documentId + " failed", e);
                }
            });
        } catch (RejectedExecutionException shuttingDown) {
            log.fine(() -> "view count for " + documentId + " dropped: executor shut down");
        }
    }

    /** Stop the view counter, letting queued increments finish. */
    @Override
    public void close() {
        background.shutdown();
        try {
            if (!background.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning("view counter did not drain in time");
                background.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            background.shutdownNow();
        }
    }

    // ---------- helpers ----------

    private List<Document> top(String domain, Comparator<Document> order, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        List<Document> all = new ArrayList<>(store.documents(domainOrPublic(domain)));
        all.sort(order);
        return all.subList(0, Math.min(limit, all.size())).stream()
                .map(Document::withoutContent)
                .toList();
    }

    private void requireWritable(String domain) {
        if (!DomainRecord.isPublicName(domain) && store.domain(domain).isEmpty()) {
            throw new NotFoundException("domain does not exist: " + domain);
        }
    }

    private static String domainOrPublic(String raw) {
        String domain = DomainRecord.normalizeName(raw);
        return domain.isEmpty() ? DomainRecord.PUBLIC : domain;
    }
}
