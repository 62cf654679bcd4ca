// file: src/main/java/io/txtlite/core/NoteContent.java
package io.txtlite.core;

/**
 * Normalization rules for note bodies coming from editors.
 */
public final class NoteContent {

    /** Placeholder shown by editors for an empty note; never stored as content. */
    public static final String EMPTY_NOTE_PLACEHOLDER = "This note is empty. Click to edit it.";

    private NoteContent() {
        // utility
    }

    /**
     * Trim surrounding whitespace and collapse the placeholder to "".
     * Null is treated as empty.
     */
    public static String normalize(String raw) {
        if (raw == null) return "";
        String trimmed = raw.strip();
        return EMPTY_NOTE_PLACEHOLDER.equals(trimmed) ? "" : trimmed;
    }

    public static boolean isEmpty(String raw) {
        return normalize(raw).isEmpty();
    }
}
