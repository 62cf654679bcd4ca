package io.txtlite.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void similar_ids_never_contain_own_id() {
        var doc = Document.empty("d1", "acme", "notes", 1000L);

        assertThrows(IllegalArgumentException.class, () -> doc.withSimilarIds(List.of("d2", "d1")));
        assertEquals(List.of("d2"), doc.withSimilarIds(List.of("d2")).similarIds());
    }

    @Test
    void domain_names_must_be_normalized() {
        assertEquals("acme", DomainRecord.normalizeName("  ACME "));
        assertThrows(IllegalArgumentException.class, () -> new DomainRecord("Acme", "h", false, 0L));
        assertTrue(DomainRecord.publicDomain().isPublic());
    }

    @Test
    void blob_ids_are_content_derived() {
        String a = ContentHash.blobId("hello".getBytes());
        String b = ContentHash.blobId("hello".getBytes());

        assertEquals(a, b);
        assertTrue(a.startsWith("sha256-"));
        assertEquals("sha256-".length() + 64, a.length());
        assertNotEquals(a, ContentHash.blobId("hello!".getBytes()));
    }
}
