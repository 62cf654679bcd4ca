package io.txtlite.storage;

import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotterTest {

    @TempDir Path dir;

    private static StoreImage imageWith(String... domainNames) {
        var domains = java.util.Arrays.stream(domainNames)
                .map(n -> new DomainRecord(n, "h", false, 0L))
                .toList();
        return new StoreImage(42L, domains, List.of(), List.of(), List.of());
    }

    @Test
    void no_snapshot_loads_null() {
        assertNull(new FileSnapshotter(dir).loadLatest());
    }

    @Test
    void keeps_only_the_newest_snapshots() {
        var snaps = new FileSnapshotter(dir, 2);
        snaps.writeSnapshot(imageWith("a"));
        snaps.writeSnapshot(imageWith("a", "b"));
        String newest = snaps.writeSnapshot(imageWith("a", "b", "c"));

        List<Path> files = snaps.listSnapshots();
        assertEquals(2, files.size());
        assertEquals(newest, files.get(1).getFileName().toString());

        var loaded = snaps.loadLatest();
        assertEquals(newest, loaded.id());
        assertEquals(3, loaded.image().domains().size());
    }

    @Test
    void corrupt_newest_snapshot_falls_back_to_previous() throws Exception {
        var snaps = new FileSnapshotter(dir, 3);
        String good = snaps.writeSnapshot(imageWith("good"));
        String bad = snaps.writeSnapshot(imageWith("good", "newer"));

        // Flip a byte in the body of the newest file.
        Path badPath = dir.resolve(bad);
        byte[] bytes = Files.readAllBytes(badPath);
        bytes[bytes.length - 3] ^= 0x5A;
        Files.write(badPath, bytes);

        var loaded = snaps.loadLatest();
        assertEquals(good, loaded.id());
        assertEquals(1, loaded.image().domains().size());
    }

    @Test
    void leftover_tmp_files_are_ignored_and_cleaned() throws Exception {
        Path tmp = dir.resolve("snapshot-000000000000001.bin.tmp");
        Files.write(tmp, new byte[]{1, 2, 3});

        var snaps = new FileSnapshotter(dir, 3);
        assertNull(snaps.loadLatest(), "tmp files are never loaded");

        snaps.writeSnapshot(imageWith("a"));
        assertFalse(Files.exists(tmp));
    }

    @Test
    void only_unreadable_snapshots_fail_instead_of_loading_empty() throws Exception {
        var snaps = new FileSnapshotter(dir, 3);
        String only = snaps.writeSnapshot(imageWith("acme"));

        Path path = dir.resolve(only);
        byte[] bytes = Files.readAllBytes(path);
        bytes[bytes.length - 1] ^= 0x5A;
        Files.write(path, bytes);

        assertThrows(PersistenceException.class, snaps::loadLatest);
        assertTrue(Files.exists(path), "unreadable snapshot must be left in place");
    }
}
