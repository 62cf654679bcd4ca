// file: src/main/java/io/txtlite/core/similarity/Tokenizer.java
package io.txtlite.core.similarity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into a set of lower-cased word tokens.
 * <p>
 * A token is a maximal run of letters or digits (Unicode aware). Punctuation,
 * markdown syntax and whitespace all act as separators.
 */
public final class Tokenizer {

    private Tokenizer() {
        // utility
    }

    /** Distinct tokens in first-seen order; empty set for null/blank text. */
    public static Set<String> tokenSet(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        StringBuilder cur = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (Character.isLetterOrDigit(cp)) {
                cur.appendCodePoint(cp);
            } else if (cur.length() > 0) {
                out.add(cur.toString().toLowerCase(Locale.ROOT));
                cur.setLength(0);
            }
            i += Character.charCount(cp);
        }
        if (cur.length() > 0) {
            out.add(cur.toString().toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }
}
