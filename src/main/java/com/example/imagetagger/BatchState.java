package com.example.imagetagger;

import com.example.imagetagger.task.TaskOutcome;

import java.util.Optional;

/**
 * Counters for one batch. All access is serialized on this object's monitor so the
 * last outcome is recognized exactly once and {@code completed} never passes
 * {@code total}.
 */
final class BatchState {
    private final int total;
    private int completed;
    private int succeeded;
    private int failed;
    private boolean finished;
    private boolean cancelled;

    BatchState(int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        this.total = total;
        this.finished = total == 0;
    }

    /**
     * Counts one outcome. Returns empty if the batch already finished or was cancelled,
     * in which case nothing changes.
     */
    synchronized Optional<BatchProgress> record(TaskOutcome outcome) {
        if (finished || cancelled) {
            return Optional.empty();
        }
        completed++;
        if (outcome.isSuccess()) {
            succeeded++;
        } else {
            failed++;
        }
        finished = completed == total;
        return Optional.of(snapshot());
    }

    /**
     * Marks the batch cancelled unless it already reached a terminal state.
     */
    synchronized boolean cancel() {
        if (finished || cancelled) {
            return false;
        }
        cancelled = true;
        return true;
    }

    synchronized BatchProgress snapshot() {
        return new BatchProgress(total, completed, succeeded, failed);
    }

    synchronized boolean isFinished() {
        return finished;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    int total() {
        return total;
    }
}
