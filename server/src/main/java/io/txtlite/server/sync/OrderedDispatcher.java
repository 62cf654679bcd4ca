// file: server/src/main/java/io/txtlite/server/sync/OrderedDispatcher.java
package io.txtlite.server.sync;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one connection's tasks on a shared pool, one at a time and in
 * submission order. At most one task of this dispatcher occupies a pool
 * thread at any moment.
 */
final class OrderedDispatcher implements Executor {
    private static final Logger log = Logger.getLogger(OrderedDispatcher.class.getName());

    private final Executor pool;
    private final Queue<Runnable> pending = new ArrayDeque<>();
    private boolean running;

    OrderedDispatcher(Executor pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (this) {
            pending.add(task);
            if (running) {
                return;
            }
            running = true;
        }
        try {
            pool.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                pending.clear();
                running = false;
            }
            throw e;
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = pending.poll();
                if (next == null) {
                    running = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "live-sync task failed", e);
            }
        }
    }
}
