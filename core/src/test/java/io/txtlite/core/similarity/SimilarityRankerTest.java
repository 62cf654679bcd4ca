package io.txtlite.core.similarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityRankerTest {

    @Test
    void ranks_by_descending_score() {
        var corpus = List.of(
                "bananas and apples",           // 0: shares "apples"
                "completely unrelated words",   // 1: nothing
                "apples pears plums"            // 2: identical
        );

        var ranked = SimilarityRanker.rank("apples pears plums", corpus, 5);

        assertEquals(3, ranked.size());
        assertEquals(2, ranked.get(0).index());
        assertEquals(1.0, ranked.get(0).score(), 1e-9);
        assertEquals(0, ranked.get(1).index());
        assertEquals(1, ranked.get(2).index());
        assertEquals(0.0, ranked.get(2).score(), 1e-9);
    }

    @Test
    void ties_keep_corpus_order() {
        var corpus = List.of("x y", "x z", "x w");

        var ranked = SimilarityRanker.rank("x", corpus, 5);

        assertEquals(List.of(0, 1, 2), ranked.stream().map(SimilarityRanker.Match::index).toList());
    }

    @Test
    void truncates_to_limit_and_scores_never_increase() {
        var corpus = List.of("a", "a b", "a b c", "a b c d", "a b c d e", "a b c d e f", "q");

        var ranked = SimilarityRanker.rank("a b c d e f", corpus, SimilarityRanker.DEFAULT_LIMIT);

        assertEquals(5, ranked.size());
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score(),
                    "scores must be non-increasing at position " + i);
        }
        assertEquals(5, ranked.get(0).index(), "exact match first");
    }

    @Test
    void empty_corpus_yields_empty_list() {
        assertTrue(SimilarityRanker.rank("anything", List.of(), 5).isEmpty());
    }

    @Test
    void negative_limit_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SimilarityRanker.rank("t", List.of("t"), -1));
    }
}
