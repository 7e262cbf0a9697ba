package com.example.imagetagger.events;

import com.example.imagetagger.BatchProgress;
import com.example.imagetagger.BatchSummary;
import com.example.imagetagger.task.TaskOutcome;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Hands every event to an executor that runs it on the consumer's thread, such as
 * {@code SwingUtilities::invokeLater} or a single-threaded executor.
 * The executor's {@code execute} must not block.
 */
public final class ExecutorProgressSink implements ProgressSink {
    private final Executor executor;
    private final ProgressSink target;

    public ExecutorProgressSink(Executor executor, ProgressSink target) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.target = ProgressSink.compose(Objects.requireNonNull(target, "target"));
    }

    @Override
    public void onLog(String message) {
        executor.execute(() -> target.onLog(message));
    }

    @Override
    public void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
        executor.execute(() -> target.onItemCompleted(outcome, progress));
    }

    @Override
    public void onBatchCompleted(BatchSummary summary) {
        executor.execute(() -> target.onBatchCompleted(summary));
    }
}
