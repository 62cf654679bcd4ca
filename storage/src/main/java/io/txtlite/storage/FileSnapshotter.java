// file: src/main/java/io/txtlite/storage/FileSnapshotter.java
package io.txtlite.storage;

import io.txtlite.core.error.PersistenceException;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Snapshot implementation backed by a single file per snapshot.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<ts>.bin.tmp" first and fsync it,
 *   - then move to "snapshot-<ts>.bin" using ATOMIC_MOVE.
 *   A crash at any point leaves the previous snapshot untouched.
 * <p>
 * Retention:
 *   - After each successful write only the newest {@code retained} snapshots
 *     are kept; stale ".tmp" leftovers are removed too.
 * <p>
 * Loading:
 *   - Newest file first; a file that fails the codec checks is skipped with a
 *     warning and the next older one is tried.
 *   - Snapshot files present but none readable is a failure, never an empty store.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;
    private final int retained;
    private long lastStamp;

    public FileSnapshotter(Path dir) {
        this(dir, 3);
    }

    public FileSnapshotter(Path dir, int retained) {
        if (retained <= 0) throw new IllegalArgumentException("retained must be > 0");
        this.dir = dir;
        this.retained = retained;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public synchronized String writeSnapshot(StoreImage image) {
        // Monotonic names even when two flushes land in the same millisecond.
        long stamp = Math.max(System.currentTimeMillis(), lastStamp + 1);
        lastStamp = stamp;
        String name = PREFIX + String.format("%015d", stamp) + SUFFIX;
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        byte[] bytes = SnapshotCodec.encode(image);
        try (var out = new FileOutputStream(tmp.toFile())) {
            out.write(bytes);
            out.flush();
            out.getFD().sync();
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("snapshot write failed: " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("snapshot rename failed: " + dst, e);
        }

        prune();
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = listSnapshots();
        for (int i = snaps.size() - 1; i >= 0; i--) {
            Path snap = snaps.get(i);
            try {
                StoreImage image = SnapshotCodec.decode(Files.readAllBytes(snap));
                return new LoadedSnapshot(snap.getFileName().toString(), image);
            } catch (IOException | PersistenceException e) {
                log.log(Level.WARNING, "skipping unreadable snapshot " + snap.getFileName(), e);
            }
        }
        if (!snaps.isEmpty()) {
            throw new PersistenceException(snaps.size() + " snapshot(s) in " + dir
                    + " and none is readable; refusing to start empty");
        }
        return null;
    }

    /** Snapshot files, oldest first. Names sort chronologically (zero-padded stamps). */
    List<Path> listSnapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("cannot list snapshot directory " + dir, e);
        }
    }

    private void prune() {
        List<Path> snaps = listSnapshots();
        for (int i = 0; i < snaps.size() - retained; i++) {
            deleteQuietly(snaps.get(i));
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX + ".tmp"))
                    .forEach(FileSnapshotter::deleteQuietly);
        } catch (IOException e) {
            log.log(Level.FINE, "tmp cleanup skipped", e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not delete " + p, e);
        }
    }
}
