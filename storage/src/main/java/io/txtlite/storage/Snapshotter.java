// file: src/main/java/io/txtlite/storage/Snapshotter.java
package io.txtlite.storage;

/**
 * Durable snapshot abstraction.
 * <p>
 * A snapshot is a full copy of the working set at some point in time.
 * On restart we load the latest readable snapshot; anything written after
 * it is lost (bounded by one compaction interval).
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the working set.
     *
     * @param image immutable copy of the working set
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(StoreImage image);

    /**
     * Load the latest readable snapshot, or null when none exists.
     *
     * @throws io.txtlite.core.error.PersistenceException when snapshots exist but none can be read
     */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, StoreImage image) {}
}
