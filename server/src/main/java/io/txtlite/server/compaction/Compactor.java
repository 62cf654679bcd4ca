// file: server/src/main/java/io/txtlite/server/compaction/Compactor.java
package io.txtlite.server.compaction;

import io.txtlite.storage.FlushPolicy;
import io.txtlite.storage.PersistenceEngine;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background daemon that persists the working set once writes settle.
 * <p>
 * Every poll interval it asks {@link FlushPolicy} whether the store has been
 * idle long enough and the last flush is old enough. If so it evicts expired
 * keys and flushes. A failed cycle is logged and retried on the next poll.
 * <p>
 * Cycles never overlap: one scheduler thread, fixed delay between cycles.
 * The last-flush time starts at construction, so the first flush happens no
 * earlier than one minimum spacing after startup.
 */
public final class Compactor {
    private static final Logger log = Logger.getLogger(Compactor.class.getName());

    private final PersistenceEngine engine;
    private final FlushPolicy policy;
    private final Duration interval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile long lastFlushMillis;

    public Compactor(PersistenceEngine engine, FlushPolicy policy, Duration interval, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.lastFlushMillis = clock.millis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "compactor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("compactor already started");
        }
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runCycle, millis, millis, TimeUnit.MILLISECONDS);
        log.info("compactor polling every " + millis + "ms");
    }

    /** Stop polling; waits for an in-flight flush to finish. */
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warning("compactor did not stop in time; interrupting");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    /**
     * One poll. Never throws.
     *
     * @return true if a flush completed
     */
    boolean runCycle() {
        try {
            return tick();
        } catch (Exception e) {
            log.log(Level.WARNING, "compaction cycle failed; retrying next poll", e);
            return false;
        }
    }

    private boolean tick() {
        long now = clock.millis();
        if (!policy.shouldFlush(now, engine.lastModifiedMillis(), lastFlushMillis)) {
            return false;
        }

        try {
            int evicted = engine.evictExpiredKeys();
            if (evicted > 0) {
                log.info("evicted " + evicted + " expired keys");
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "key eviction failed", e);
        }

        String snapshotId = engine.flush();
        lastFlushMillis = clock.millis();
        log.fine(() -> "flushed snapshot " + snapshotId);
        return true;
    }

    long lastFlushMillis() {
        return lastFlushMillis;
    }
}
