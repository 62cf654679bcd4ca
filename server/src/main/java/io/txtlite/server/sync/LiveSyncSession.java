// file: server/src/main/java/io/txtlite/server/sync/LiveSyncSession.java
package io.txtlite.server.sync;

import io.txtlite.core.Document;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.NoteContent;
import io.txtlite.server.auth.DomainService;
import io.txtlite.server.docs.DocumentService;
import io.txtlite.server.dto.SyncMessage;
import io.txtlite.server.dto.SyncReply;
import io.txtlite.server.similarity.SimilarityIndexer;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-connection state machine for live editing.
 * <p>
 * States:
 *  - UNVALIDATED: initial. The first frame decides the domain for the whole
 *    connection. The public domain always validates; any other domain needs
 *    a key resolving to exactly that domain. A failed check is never retried.
 *  - VALIDATED: every frame with an id is saved into the pinned domain and
 *    answered with "unique_slug"; frames without an id get "not saving", and
 *    so do frames whose id already belongs to a document of another domain.
 *  - CLOSED: terminal. The similarity cache of the last edited document is
 *    recomputed once, unless it lives in the public domain.
 * <p>
 * Frames are handled one at a time per connection.
 */
public class LiveSyncSession {
    private static final Logger log = Logger.getLogger(LiveSyncSession.class.getName());

    public enum State { UNVALIDATED, VALIDATED, CLOSED }

    private final DomainService domains;
    private final DocumentService documents;
    private final SimilarityIndexer indexer;
    private final Clock clock;

    private State state = State.UNVALIDATED;
    private boolean checked;
    private String domain;
    private Document lastEdited;

    public LiveSyncSession(DomainService domains,
                           DocumentService documents,
                           SimilarityIndexer indexer,
                           Clock clock) {
        this.domains = Objects.requireNonNull(domains, "domains");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized SyncReply onMessage(SyncMessage msg) {
        Objects.requireNonNull(msg, "msg");
        if (state == State.CLOSED) {
            throw new IllegalStateException("session is closed");
        }
        if (!checked) {
            checked = true;
            validate(msg);
        }
        if (state != State.VALIDATED || msg.id == null || msg.id.isBlank()) {
            return SyncReply.notSaving();
        }

        Optional<Document> existing = documents.find(msg.id);
        if (existing.isPresent() && !existing.get().domain().equals(domain)) {
            log.warning("live-sync session for " + domain + " refused to save "
                    + msg.id + " owned by another domain");
            return SyncReply.notSaving();
        }

        String slug = msg.slug == null ? "" : msg.slug;
        long now = clock.millis();
        try {
            lastEdited = documents.save(new Document(msg.id, domain, slug,
                    NoteContent.normalize(msg.data), now, now, 0L, List.of()));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "live-sync save of " + msg.id + " failed", e);
            return SyncReply.notSaving();
        }
        int sharing = documents.get(slug, domain).size();
        return SyncReply.saved(msg.id, slug, sharing < 2);
    }

    /** Idempotent. */
    public synchronized void onClose() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        if (lastEdited == null || DomainRecord.isPublicName(lastEdited.domain())) {
            return;
        }
        try {
            indexer.index(lastEdited.domain(), lastEdited.id());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "similarity update for " + lastEdited.id() + " failed", e);
        }
    }

    public synchronized State state() {
        return state;
    }

    /** Pinned domain, or null while unvalidated. */
    public synchronized String domain() {
        return domain;
    }

    private void validate(SyncMessage msg) {
        String requested = DomainRecord.normalizeName(msg.domain);
        if (requested.isEmpty()) {
            requested = DomainRecord.PUBLIC;
        }
        if (DomainRecord.isPublicName(requested) || domains.holdsKey(requested, msg.domainKey)) {
            domain = requested;
            state = State.VALIDATED;
            log.fine("live-sync session validated for domain " + requested);
        } else {
            log.fine("live-sync session rejected for domain " + requested);
        }
    }
}
