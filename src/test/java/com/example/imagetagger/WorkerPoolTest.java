package com.example.imagetagger;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolTest {
    @Test
    void neverRunsMoreThanConcurrencyTasks() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try (WorkerPool pool = new WorkerPool(3)) {
            for (int i = 0; i < 30; i++) {
                futures.add(pool.submit(() -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    sleep(5);
                    running.decrementAndGet();
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        }

        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
        assertTrue(peak.get() >= 2, "pool never ran tasks in parallel");
    }

    @Test
    void failingTaskDoesNotBreakThePool() throws Exception {
        try (WorkerPool pool = new WorkerPool(1)) {
            Future<?> failing = pool.submit(() -> {
                throw new IllegalStateException("boom");
            });
            Future<String> next = pool.submit(() -> "still alive");

            assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
            assertEquals("still alive", next.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void rejectsSubmissionsAfterShutdown() {
        WorkerPool pool = new WorkerPool(2);
        pool.shutdown();

        assertTrue(pool.isShutdown());
        assertThrows(PoolClosedException.class, () -> pool.submit(() -> { }));
    }

    @Test
    void shutdownLetsAcceptedTasksFinish() throws Exception {
        WorkerPool pool = new WorkerPool(2);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            pool.submit(() -> {
                await(release);
                finished.incrementAndGet();
            });
        }

        while (pool.activeCount() < 2) {
            Thread.sleep(5);
        }
        assertEquals(3, pool.queuedCount());

        pool.shutdown();
        assertFalse(pool.isTerminated());
        release.countDown();

        assertTrue(pool.awaitTermination(Duration.ofSeconds(10)));
        assertTrue(pool.isTerminated());
        assertEquals(0, pool.queuedCount());
        assertEquals(5, finished.get());
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
