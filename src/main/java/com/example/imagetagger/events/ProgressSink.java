package com.example.imagetagger.events;

import com.example.imagetagger.BatchProgress;
import com.example.imagetagger.BatchSummary;
import com.example.imagetagger.task.TaskOutcome;

import java.util.List;

/**
 * Receives batch events from worker threads. Callbacks arrive on whichever thread
 * produced them and must return quickly without blocking; a consumer bound to a
 * single thread should be reached through {@link QueuedProgressSink} or
 * {@link ExecutorProgressSink}.
 */
public interface ProgressSink {
    /**
     * Informational message about an item being processed.
     */
    default void onLog(String message) {
    }

    /**
     * Called exactly once per item, with the counters as they stood right after it.
     */
    default void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
    }

    /**
     * Called exactly once per batch, after the last item event of that batch.
     */
    default void onBatchCompleted(BatchSummary summary) {
    }

    ProgressSink NONE = new ProgressSink() {
    };

    /**
     * Fans events out to every sink in order. A sink that throws does not stop the others.
     */
    static ProgressSink compose(ProgressSink... sinks) {
        return new CompositeProgressSink(List.of(sinks));
    }
}
