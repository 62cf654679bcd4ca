package io.txtlite.server.docs;

import io.txtlite.core.Document;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.NoteContent;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.server.MutableClock;
import io.txtlite.storage.SnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DocumentServiceTest {

    @TempDir Path dataDir;
    private MutableClock clock;
    private SnapshotStore store;
    private DocumentService docs;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000L);
        store = SnapshotStore.open(dataDir, 3, Duration.ofDays(30), clock);
        store.insertDomain(new DomainRecord("acme", "h", false, 0L));
        docs = new DocumentService(store, clock, Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() {
        docs.close();
    }

    private Document doc(String id, String domain, String slug, String content) {
        return new Document(id, domain, slug, content, 0L, 0L, 0L, List.of());
    }

    @Test
    void save_then_get_by_slug() {
        docs.save(doc("d1", "acme", "notes", "hello"));

        List<Document> found = docs.get("notes", "acme");
        assertEquals(1, found.size());
        assertEquals("hello", found.get(0).content());
        assertTrue(docs.exists("notes", "acme"));
        assertFalse(docs.exists("notes", "public"));
    }

    @Test
    void duplicate_slugs_are_allowed() {
        docs.save(doc("d1", "acme", "notes", "one"));
        docs.save(doc("d2", "acme", "notes", "two"));

        assertEquals(List.of("d1", "d2"), docs.get("notes", "acme").stream().map(Document::id).toList());
    }

    @Test
    void placeholder_and_whitespace_count_as_empty() {
        docs.save(doc("d1", "acme", "a", NoteContent.EMPTY_NOTE_PLACEHOLDER));
        docs.save(doc("d2", "acme", "b", "   \n"));

        assertEquals("", docs.find("d1").orElseThrow().content());
        assertEquals("", docs.find("d2").orElseThrow().content());
    }

    @Test
    void upsert_keeps_created_views_and_similar() {
        docs.save(doc("d1", "acme", "a", "first"));
        docs.save(doc("d2", "acme", "b", "other"));
        store.computeDocument("d1", prev -> prev.withViews(7).withSimilarIds(List.of("d2")));

        clock.advanceMillis(5_000);
        Document saved = docs.save(doc("d1", "acme", "renamed", "second"));

        assertEquals(1_000L, saved.createdMillis());
        assertEquals(6_000L, saved.modifiedMillis());
        assertEquals(7L, saved.views());
        assertEquals(List.of("d2"), saved.similarIds());
        assertEquals("renamed", saved.slug());
        assertEquals("second", saved.content());
    }

    @Test
    void saving_into_an_unknown_domain_fails() {
        assertThrows(NotFoundException.class, () -> docs.save(doc("d1", "ghost", "a", "x")));
        assertTrue(docs.find("d1").isEmpty());
    }

    @Test
    void blank_domain_means_public() {
        docs.save(doc("d1", "", "a", "x"));
        assertEquals("public", docs.find("d1").orElseThrow().domain());
    }

    @Test
    void recency_and_popularity_lists() {
        docs.save(doc("old", "acme", "a", "x"));
        clock.advanceMillis(10);
        docs.save(doc("new", "acme", "b", "y"));
        store.computeDocument("old", prev -> prev.withViews(3));

        assertEquals(List.of("new", "old"),
                docs.mostRecentlyModified("acme", 10).stream().map(Document::id).toList());
        assertEquals(List.of("old", "new"),
                docs.mostViewed("acme", 10).stream().map(Document::id).toList());
        assertEquals(1, docs.mostViewed("acme", 1).size());
        assertEquals("", docs.mostViewed("acme", 1).get(0).content());
    }

    @Test
    void search_requires_every_query_token() {
        docs.save(doc("d1", "acme", "groceries", "milk eggs bread"));
        clock.advanceMillis(10);
        docs.save(doc("d2", "acme", "baking", "flour eggs sugar"));
        docs.save(doc("d3", "public", "groceries", "milk eggs"));

        assertEquals(List.of("d2", "d1"), docs.search("EGGS", "acme").stream().map(Document::id).toList());
        assertEquals(List.of("d1"), docs.search("eggs groceries", "acme").stream().map(Document::id).toList());
        assertTrue(docs.search("  ", "acme").isEmpty());
        assertTrue(docs.search("caviar", "acme").isEmpty());
    }

    @Test
    void get_all_lists_the_domain_in_creation_order() {
        docs.save(doc("d1", "acme", "a", "body one"));
        clock.advanceMillis(10);
        docs.save(doc("d2", "acme", "b", "body two"));
        docs.save(doc("p1", "public", "a", "elsewhere"));

        List<Document> all = docs.getAll("acme");
        assertEquals(List.of("d1", "d2"), all.stream().map(Document::id).toList());
        assertEquals("body one", all.get(0).content());
    }

    @Test
    void view_increments_run_in_the_background() {
        docs.save(doc("d1", "acme", "a", "x"));
        docs.incrementView("d1");
        docs.incrementView("d1");
        docs.close();

        assertEquals(2L, store.document("d1").orElseThrow().views());
    }

    @Test
    void view_increment_failures_never_reach_the_caller() {
        assertDoesNotThrow(() -> docs.incrementView("missing"));
        docs.close();
        assertDoesNotThrow(() -> docs.incrementView("missing"));
    }

    @Test
    void similar_skips_ids_that_no_longer_resolve() {
        docs.save(doc("d1", "acme", "a", "x"));
        docs.save(doc("d2", "acme", "b", "y"));
        store.computeDocument("d1", prev -> prev.withSimilarIds(List.of("gone", "d2")));

        assertEquals(List.of("d2"), docs.similar("d1").stream().map(Document::id).toList());
        assertThrows(NotFoundException.class, () -> docs.similar("nope"));
    }

    @Test
    void new_pages_and_empty_documents() {
        Document page = docs.newPage("acme");
        assertEquals(page.id(), page.slug());
        assertEquals("", page.content());

        Document empty = docs.createEmpty("acme", "todo");
        assertEquals("todo", empty.slug());
        assertEquals(1, docs.get("todo", "acme").size());
    }
}
