package io.txtlite.storage;

import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreDurabilityTest {

    @TempDir Path dataDir;

    private SnapshotStore open(MutableClock clock) {
        return SnapshotStore.open(dataDir, 3, Duration.ofDays(30), clock);
    }

    @Test
    void flushed_state_survives_restart() {
        var clock = new MutableClock(1_000_000L);
        var store1 = open(clock);

        store1.insertDomain(new DomainRecord("acme", "$2a$hash", false, 1L));
        store1.putKey(new DomainKey("tokenhash", "acme", 2L, 2L));
        store1.computeDocument("d1", prev -> new Document("d1", "acme", "notes", "hello world",
                10L, 20L, 3L, List.of()));
        store1.computeDocument("d2", prev -> new Document("d2", "acme", "other", "hello there",
                11L, 21L, 0L, List.of("d1")));
        store1.insertBlob(new Blob("sha256-aa", "a.txt", new byte[]{1, 2, 3}, 5L));
        store1.flush();

        // "Crash": drop reference; new instance recovers from disk
        var store2 = open(clock);

        assertTrue(store2.domain("acme").isPresent());
        assertFalse(store2.domain("acme").get().isPublic());
        assertEquals("acme", store2.key("tokenhash").orElseThrow().domain());
        Document d1 = store2.document("d1").orElseThrow();
        assertEquals("hello world", d1.content());
        assertEquals(3L, d1.views());
        assertEquals(List.of("d1"), store2.document("d2").orElseThrow().similarIds());
        assertEquals(List.of("d1", "d2"), store2.documents("acme").stream().map(Document::id).toList());
        assertArrayEquals(new byte[]{1, 2, 3}, store2.blob("sha256-aa").orElseThrow().compressed());
        assertEquals(store1.lastModifiedMillis(), store2.lastModifiedMillis());
    }

    @Test
    void writes_after_last_flush_are_lost_on_restart() {
        var clock = new MutableClock(1_000_000L);
        var store1 = open(clock);
        store1.insertDomain(new DomainRecord("acme", "h", false, 1L));
        store1.flush();

        store1.insertDomain(new DomainRecord("late", "h", false, 2L));

        var store2 = open(clock);
        assertTrue(store2.domain("acme").isPresent());
        assertTrue(store2.domain("late").isEmpty(), "unflushed write must not survive");
    }

    @Test
    void empty_directory_opens_empty_store() {
        var store = open(new MutableClock(5L));

        assertTrue(store.documents("public").isEmpty());
        assertEquals(0L, store.lastModifiedMillis());
    }

    @Test
    void corrupt_only_snapshot_refuses_to_open() throws Exception {
        var clock = new MutableClock(1_000_000L);
        var store1 = open(clock);
        store1.insertDomain(new DomainRecord("acme", "h", false, 1L));
        String id = store1.flush();

        Path snap = dataDir.resolve(id);
        byte[] bytes = Files.readAllBytes(snap);
        bytes[bytes.length - 1] ^= 0x5A;
        Files.write(snap, bytes);

        assertThrows(PersistenceException.class, () -> open(clock));
        assertArrayEquals(bytes, Files.readAllBytes(snap));
    }
}
