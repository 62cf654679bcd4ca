// file: src/main/java/io/txtlite/core/similarity/SimilarityRanker.java
package io.txtlite.core.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ranks a corpus of texts against a target text.
 * <p>
 * Algorithm:
 *  1) Tokenize the target and every corpus member into token sets.
 *  2) Score each member with {@link JaccardSimilarity}.
 *  3) Sort by descending score; equal scores keep corpus order (stable sort).
 *  4) Truncate to {@code limit}.
 * <p>
 * Cost is O(corpus size * average token count); callers run it once per
 * edit session, never per keystroke.
 */
public final class SimilarityRanker {

    /** Default number of similar documents kept per document. */
    public static final int DEFAULT_LIMIT = 5;

    /** One ranked corpus member: its index in the input list and its score. */
    public record Match(int index, double score) {}

    private SimilarityRanker() {
        // utility
    }

    public static List<Match> rank(String target, List<String> corpus, int limit) {
        Objects.requireNonNull(corpus, "corpus");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        if (corpus.isEmpty() || limit == 0) {
            return List.of();
        }

        Set<String> targetTokens = Tokenizer.tokenSet(target);
        List<Match> matches = new ArrayList<>(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            double s = JaccardSimilarity.score(targetTokens, Tokenizer.tokenSet(corpus.get(i)));
            matches.add(new Match(i, s));
        }

        // List.sort is stable, so ties stay in corpus order.
        matches.sort(Comparator.comparingDouble(Match::score).reversed());
        return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
    }
}
