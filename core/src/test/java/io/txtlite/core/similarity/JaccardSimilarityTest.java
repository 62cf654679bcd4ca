package io.txtlite.core.similarity;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JaccardSimilarityTest {

    @Test
    void ratio_of_intersection_over_union() {
        // {a,b,c} vs {b,c,d}: 2 shared out of 4 distinct
        assertEquals(0.5, JaccardSimilarity.score(Set.of("a", "b", "c"), Set.of("b", "c", "d")), 1e-9);
    }

    @Test
    void disjoint_and_empty_sets_score_zero() {
        assertEquals(0.0, JaccardSimilarity.score(Set.of("a"), Set.of("b")), 1e-9);
        assertEquals(0.0, JaccardSimilarity.score(Set.of(), Set.of()), 1e-9);
        assertEquals(0.0, JaccardSimilarity.score(Set.of("a"), Set.of()), 1e-9);
    }

    @Test
    void tokenizer_lowercases_and_splits_on_punctuation() {
        var tokens = Tokenizer.tokenSet("# Hello, World! hello_world 42");

        assertEquals(Set.of("hello", "world", "42"), tokens);
        assertTrue(Tokenizer.tokenSet("  ").isEmpty());
        assertTrue(Tokenizer.tokenSet(null).isEmpty());
    }
}
