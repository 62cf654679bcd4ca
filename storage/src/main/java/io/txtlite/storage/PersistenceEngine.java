// file: src/main/java/io/txtlite/storage/PersistenceEngine.java
package io.txtlite.storage;

/**
 * Lifecycle contract of the persistence layer, as driven by the background
 * compactor and the shutdown hook.
 */
public interface PersistenceEngine {

    /** Epoch millis of the most recently accepted mutation (0 if none since open). */
    long lastModifiedMillis();

    /**
     * Durably write the current working set. Atomic: a failure part-way never
     * damages the previously written snapshot.
     *
     * @return identifier of the snapshot written
     * @throws io.txtlite.core.error.PersistenceException on I/O failure
     */
    String flush();

    /**
     * Remove keys not used within the retention window.
     *
     * @return number of keys removed
     */
    int evictExpiredKeys();
}
