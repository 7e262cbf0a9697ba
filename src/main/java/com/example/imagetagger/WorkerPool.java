package com.example.imagetagger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool running at most {@code concurrency} tasks at once. Extra tasks wait
 * in an unbounded FIFO queue. The pool is open from construction until
 * {@link #shutdown()}; tasks already accepted still run after shutdown.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofHours(1);

    private final int concurrency;
    private final ThreadPoolExecutor executor;

    public WorkerPool(int concurrency) {
        this(concurrency, "metadata-worker");
    }

    public WorkerPool(int concurrency, String threadNamePrefix) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.concurrency = concurrency;
        this.executor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory(threadNamePrefix),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Queues a task. Exceptions thrown by the task are captured in the returned future
     * and do not affect the pool.
     *
     * @throws PoolClosedException if the pool has been shut down
     */
    public Future<?> submit(Runnable task) {
        ensureOpen();
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException ex) {
            throw new PoolClosedException("Worker pool is shut down", ex);
        }
    }

    public <T> Future<T> submit(Callable<T> task) {
        ensureOpen();
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException ex) {
            throw new PoolClosedException("Worker pool is shut down", ex);
        }
    }

    /**
     * Stops accepting tasks. Running and queued tasks are left to finish.
     */
    public void shutdown() {
        if (!executor.isShutdown()) {
            LOGGER.debug("Shutting down worker pool with {} queued tasks", executor.getQueue().size());
        }
        executor.shutdown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public int concurrency() {
        return concurrency;
    }

    public int activeCount() {
        return executor.getActiveCount();
    }

    public int queuedCount() {
        return executor.getQueue().size();
    }

    /**
     * Shuts down and waits for accepted tasks to finish.
     */
    @Override
    public void close() {
        shutdown();
        try {
            if (!awaitTermination(CLOSE_TIMEOUT)) {
                LOGGER.warn("Worker pool did not terminate within {}", CLOSE_TIMEOUT);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for worker pool to stop.", ex);
            executor.shutdownNow();
        }
    }

    private void ensureOpen() {
        if (executor.isShutdown()) {
            throw new PoolClosedException("Worker pool is shut down");
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        }
    }
}
