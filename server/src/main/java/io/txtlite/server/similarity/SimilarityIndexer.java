// file: server/src/main/java/io/txtlite/server/similarity/SimilarityIndexer.java
package io.txtlite.server.similarity;

import io.txtlite.core.Document;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.similarity.SimilarityRanker;
import io.txtlite.storage.TextStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recomputes the similarity cache of one document against the rest of its
 * domain and stores the result on the document.
 * <p>
 * The document itself is never part of the corpus, so it can never list
 * itself. Ties keep creation order.
 */
public class SimilarityIndexer {
    private static final Logger log = Logger.getLogger(SimilarityIndexer.class.getName());

    private final TextStore store;
    private final int limit;

    public SimilarityIndexer(TextStore store) {
        this(store, SimilarityRanker.DEFAULT_LIMIT);
    }

    public SimilarityIndexer(TextStore store, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.store = Objects.requireNonNull(store, "store");
        this.limit = limit;
    }

    /**
     * @return the ranked ids now cached on the document
     * @throws NotFoundException when the document is not in the domain
     */
    public List<String> index(String domain, String documentId) {
        Document target = null;
        List<String> ids = new ArrayList<>();
        List<String> corpus = new ArrayList<>();
        for (Document d : store.documents(domain)) {
            if (d.id().equals(documentId)) {
                target = d;
            } else {
                ids.add(d.id());
                corpus.add(d.content());
            }
        }
        if (target == null) {
            throw new NotFoundException("document " + documentId + " not found in domain " + domain);
        }

        List<String> similar = new ArrayList<>();
        for (SimilarityRanker.Match m : SimilarityRanker.rank(target.content(), corpus, limit)) {
            similar.add(ids.get(m.index()));
        }

        store.computeDocument(documentId, prev -> {
            if (prev == null) {
                throw new NotFoundException("document " + documentId + " vanished while indexing");
            }
            return prev.withSimilarIds(similar);
        });
        log.fine(() -> "indexed " + documentId + " against " + corpus.size() + " documents: " + similar);
        return List.copyOf(similar);
    }
}
