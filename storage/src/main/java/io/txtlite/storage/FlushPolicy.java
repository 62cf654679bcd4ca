// file: src/main/java/io/txtlite/storage/FlushPolicy.java
package io.txtlite.storage;

import java.time.Duration;
import java.util.Objects;

/**
 * Debounce rule deciding when a compaction cycle may flush.
 * <p>
 * A flush is allowed only when BOTH hold:
 *  - the store has been idle for strictly longer than {@code idle}
 *    (no accepted mutation since), and
 *  - strictly more than {@code minSpacing} has passed since the last flush.
 * <p>
 * Bursts of activity therefore never trigger a flush; quiet periods always
 * do, within one poll interval.
 */
public final class FlushPolicy {
    private final long idleMillis;
    private final long minSpacingMillis;

    public FlushPolicy(Duration idle, Duration minSpacing) {
        Objects.requireNonNull(idle, "idle");
        Objects.requireNonNull(minSpacing, "minSpacing");
        if (idle.isNegative()) throw new IllegalArgumentException("idle must be >= 0");
        if (minSpacing.isNegative()) throw new IllegalArgumentException("minSpacing must be >= 0");
        this.idleMillis = idle.toMillis();
        this.minSpacingMillis = minSpacing.toMillis();
    }

    /** 3s idle, 10s spacing. */
    public static FlushPolicy defaults() {
        return new FlushPolicy(Duration.ofSeconds(3), Duration.ofSeconds(10));
    }

    public boolean shouldFlush(long nowMillis, long lastModifiedMillis, long lastFlushMillis) {
        return nowMillis - lastModifiedMillis > idleMillis
                && nowMillis - lastFlushMillis > minSpacingMillis;
    }
}
