package io.txtlite.server.sync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrderedDispatcherTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void tasks_run_off_the_caller_in_submission_order_one_at_a_time() throws Exception {
        var dispatcher = new OrderedDispatcher(pool);
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Thread caller = Thread.currentThread();
        AtomicInteger ranOnCaller = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            dispatcher.execute(() -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                if (Thread.currentThread() == caller) {
                    ranOnCaller.incrementAndGet();
                }
                seen.add(n);
                inFlight.decrementAndGet();
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxInFlight.get());
        assertEquals(0, ranOnCaller.get());
        for (int i = 0; i < 200; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void a_slow_connection_does_not_hold_up_another() throws Exception {
        var slow = new OrderedDispatcher(pool);
        var fast = new OrderedDispatcher(pool);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(1);

        slow.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        fast.execute(fastDone::countDown);

        assertTrue(fastDone.await(2, TimeUnit.SECONDS));
        release.countDown();
    }

    @Test
    void a_failing_task_does_not_stop_later_ones() throws Exception {
        var dispatcher = new OrderedDispatcher(pool);
        CountDownLatch after = new CountDownLatch(1);

        dispatcher.execute(() -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.execute(after::countDown);

        assertTrue(after.await(2, TimeUnit.SECONDS));
    }

    @Test
    void rejection_surfaces_and_leaves_the_dispatcher_usable() throws Exception {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        var rejecting = new OrderedDispatcher(closed);
        assertThrows(RejectedExecutionException.class, () -> rejecting.execute(() -> { }));
        assertThrows(RejectedExecutionException.class, () -> rejecting.execute(() -> { }),
                "a rejected submit must not leave the dispatcher stuck as running");
    }
}
