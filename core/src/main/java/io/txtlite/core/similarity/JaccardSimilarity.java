// file: src/main/java/io/txtlite/core/similarity/JaccardSimilarity.java
package io.txtlite.core.similarity;

import java.util.Set;

/**
 * Token-set overlap ratio: |A ∩ B| / |A ∪ B|.
 * <p>
 * Range [0, 1]. Two empty sets score 0 (nothing in common to speak of).
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
        // utility
    }

    public static double score(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        // Iterate the smaller set.
        Set<String> small = a.size() <= b.size() ? a : b;
        Set<String> large = small == a ? b : a;
        int intersection = 0;
        for (String t : small) {
            if (large.contains(t)) intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return intersection / (double) union;
    }
}
