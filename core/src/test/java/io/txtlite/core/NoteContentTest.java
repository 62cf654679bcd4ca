package io.txtlite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoteContentTest {

    @Test
    void placeholder_collapses_to_empty() {
        assertEquals("", NoteContent.normalize(NoteContent.EMPTY_NOTE_PLACEHOLDER));
        assertEquals("", NoteContent.normalize("\n  " + NoteContent.EMPTY_NOTE_PLACEHOLDER + "  \n"));
        assertTrue(NoteContent.isEmpty(null));
    }

    @Test
    void regular_content_is_trimmed_only() {
        assertEquals("# title\n\nbody", NoteContent.normalize("  # title\n\nbody \n"));
    }
}
