package com.example.imagetagger;

import com.example.imagetagger.events.ProgressSink;
import com.example.imagetagger.task.FailureReason;
import com.example.imagetagger.task.TaskOutcome;
import com.example.imagetagger.task.TaskUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one batch at a time on a {@link WorkerPool}: submits a task per item, counts
 * outcomes as workers finish them and reports a single completion per batch.
 *
 * <p>State moves {@code IDLE -> RUNNING -> COMPLETING -> COMPLETED}; an empty batch
 * goes straight to {@code COMPLETED}. With {@code resetOnCompletion} the coordinator
 * drops back to {@code IDLE} instead of staying in {@code COMPLETED} until
 * {@link #reset()}.
 *
 * <p>Outcome counting runs on worker threads. Each batch's counters are guarded by
 * the monitor of its {@link BatchState}, and sink callbacks for a batch are made
 * while holding it, so the sink sees item events in counter order and the batch
 * event last.
 */
public final class BatchCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);

    private final WorkerPool pool;
    private final TaskUnit task;
    private final ProgressSink sink;
    private final boolean resetOnCompletion;
    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.IDLE);
    private final AtomicLong generation = new AtomicLong();
    private volatile BatchHandle current;

    public BatchCoordinator(WorkerPool pool, TaskUnit task, ProgressSink sink) {
        this(pool, task, sink, false);
    }

    public BatchCoordinator(WorkerPool pool, TaskUnit task, ProgressSink sink, boolean resetOnCompletion) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.task = Objects.requireNonNull(task, "task");
        this.sink = ProgressSink.compose(sink == null ? ProgressSink.NONE : sink);
        this.resetOnCompletion = resetOnCompletion;
    }

    /**
     * Starts a batch over {@code items} and returns without waiting for it.
     *
     * @throws BatchInProgressException if the previous batch has not completed
     * @throws PoolClosedException      if the pool refused a task; nothing of the batch is counted
     */
    public synchronized BatchHandle start(List<WorkItem> items) {
        CoordinatorState currentState = state.get();
        if (!currentState.acceptsNewBatch()) {
            throw new BatchInProgressException(current.id(), currentState);
        }
        List<WorkItem> batchItems = List.copyOf(items);
        BatchHandle handle = new BatchHandle(
                generation.incrementAndGet(), this, new BatchState(batchItems.size()), Instant.now());
        current = handle;

        if (batchItems.isEmpty()) {
            LOGGER.info("Batch {} has no items; completing immediately.", handle.id());
            completeEmpty(handle);
            return handle;
        }

        state.set(CoordinatorState.RUNNING);
        LOGGER.info("Starting batch {} with {} items on {} workers.", handle.id(), batchItems.size(), pool.concurrency());
        sink.onLog("Processing " + batchItems.size() + " images");
        try {
            for (WorkItem item : batchItems) {
                pool.submit(() -> runTask(handle, item));
            }
        } catch (PoolClosedException ex) {
            rollback(handle, ex);
            throw ex;
        }
        return handle;
    }

    public CoordinatorState state() {
        return state.get();
    }

    public Optional<BatchHandle> currentBatch() {
        return Optional.ofNullable(current);
    }

    /**
     * Returns a completed coordinator to {@code IDLE}.
     *
     * @throws BatchInProgressException if a batch is still running
     */
    public synchronized void reset() {
        CoordinatorState currentState = state.get();
        if (!currentState.acceptsNewBatch()) {
            throw new BatchInProgressException(current.id(), currentState);
        }
        state.set(CoordinatorState.IDLE);
    }

    boolean cancel(BatchHandle handle) {
        BatchSummary summary;
        synchronized (handle.state()) {
            if (!handle.state().cancel()) {
                return false;
            }
            state.compareAndSet(CoordinatorState.RUNNING, CoordinatorState.COMPLETING);
            summary = BatchSummary.of(handle.id(), handle.state().snapshot(), true, handle.startedAt());
            LOGGER.info("Batch {} cancelled after {} of {} items.", handle.id(), summary.completed(), summary.total());
            sink.onLog("Cancelled after " + summary.completed() + " of " + summary.total() + " images");
            sink.onBatchCompleted(summary);
            state.set(terminalState());
        }
        handle.complete(summary);
        return true;
    }

    private void runTask(BatchHandle handle, WorkItem item) {
        if (!isCurrent(handle)) {
            LOGGER.debug("Skipping {}; batch {} is no longer active.", item.path(), handle.id());
            return;
        }
        TaskOutcome outcome;
        try {
            outcome = task.execute(item);
        } catch (RuntimeException | Error ex) {
            // The item must still be counted or the batch never completes.
            LOGGER.error("Task for {} threw instead of returning an outcome", item.path(), ex);
            outcome = TaskOutcome.failure(item, FailureReason.UNEXPECTED, String.valueOf(ex));
        }
        onTaskCompleted(handle, outcome);
    }

    private void onTaskCompleted(BatchHandle handle, TaskOutcome outcome) {
        BatchSummary summary = null;
        synchronized (handle.state()) {
            if (!isCurrent(handle)) {
                LOGGER.debug("Ignoring outcome for superseded batch {}: {}", handle.id(), outcome);
                return;
            }
            Optional<BatchProgress> recorded = handle.state().record(outcome);
            if (recorded.isEmpty()) {
                return;
            }
            BatchProgress progress = recorded.get();
            sink.onItemCompleted(outcome, progress);
            if (progress.isFinished()) {
                // record() reports the finishing outcome exactly once, so only one worker gets here.
                state.compareAndSet(CoordinatorState.RUNNING, CoordinatorState.COMPLETING);
                summary = BatchSummary.of(handle.id(), progress, false, handle.startedAt());
                LOGGER.info("Batch {} completed: {} succeeded, {} failed.",
                        handle.id(), summary.succeeded(), summary.failed());
                sink.onBatchCompleted(summary);
                state.set(terminalState());
            }
        }
        if (summary != null) {
            handle.complete(summary);
        }
    }

    private void completeEmpty(BatchHandle handle) {
        BatchSummary summary = BatchSummary.of(handle.id(), handle.state().snapshot(), false, handle.startedAt());
        state.set(CoordinatorState.COMPLETING);
        sink.onBatchCompleted(summary);
        state.set(terminalState());
        handle.complete(summary);
    }

    private void rollback(BatchHandle handle, PoolClosedException cause) {
        LOGGER.warn("Worker pool rejected batch {}; abandoning it.", handle.id(), cause);
        synchronized (handle.state()) {
            handle.state().cancel();
        }
        generation.incrementAndGet();
        current = null;
        state.set(CoordinatorState.IDLE);
        handle.abort(cause);
    }

    private boolean isCurrent(BatchHandle handle) {
        return handle.id() == generation.get() && !handle.state().isCancelled();
    }

    private CoordinatorState terminalState() {
        return resetOnCompletion ? CoordinatorState.IDLE : CoordinatorState.COMPLETED;
    }
}
