package com.example.imagetagger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's view of a started batch.
 */
public final class BatchHandle {
    private final long id;
    private final BatchCoordinator coordinator;
    private final BatchState state;
    private final Instant startedAt;
    private final CompletableFuture<BatchSummary> completion = new CompletableFuture<>();

    BatchHandle(long id, BatchCoordinator coordinator, BatchState state, Instant startedAt) {
        this.id = id;
        this.coordinator = coordinator;
        this.state = state;
        this.startedAt = startedAt;
    }

    public long id() {
        return id;
    }

    public int total() {
        return state.total();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public BatchProgress progress() {
        return state.snapshot();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public boolean isCancelled() {
        return state.isCancelled();
    }

    /**
     * Completes with the batch summary. Dependent actions run on the thread that
     * finished the batch, usually a worker thread.
     */
    public CompletionStage<BatchSummary> completion() {
        return completion.minimalCompletionStage();
    }

    /**
     * Blocks until the batch completes.
     */
    public BatchSummary await() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Batch " + id + " did not start", ex.getCause());
        }
    }

    public Optional<BatchSummary> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            return Optional.empty();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Batch " + id + " did not start", ex.getCause());
        }
    }

    /**
     * Stops the batch: queued items are skipped and outcomes of running items are
     * ignored. Returns false if the batch had already finished.
     */
    public boolean cancel() {
        return coordinator.cancel(this);
    }

    BatchState state() {
        return state;
    }

    void complete(BatchSummary summary) {
        completion.complete(summary);
    }

    void abort(Throwable cause) {
        completion.completeExceptionally(cause);
    }
}
