package com.example.imagetagger.events;

import com.example.imagetagger.BatchProgress;
import com.example.imagetagger.BatchSummary;
import com.example.imagetagger.task.TaskOutcome;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Buffers events published from worker threads so a single consumer thread can
 * replay them on its own schedule. Publishing only enqueues and never blocks.
 *
 * <p>The consumer either polls with {@link #drainTo(ProgressSink)} (e.g. from a UI
 * timer) or parks its own thread in {@link #dispatchUntilComplete(ProgressSink)}.
 */
public final class QueuedProgressSink implements ProgressSink {
    private final BlockingQueue<BatchEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void onLog(String message) {
        queue.offer(new LogEvent(message));
    }

    @Override
    public void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
        queue.offer(new ItemCompletedEvent(outcome, progress));
    }

    @Override
    public void onBatchCompleted(BatchSummary summary) {
        queue.offer(new BatchCompletedEvent(summary));
    }

    /**
     * Delivers every queued event to {@code target} on the calling thread and returns
     * how many were delivered. Never waits for new events.
     */
    public int drainTo(ProgressSink target) {
        ProgressSink guarded = ProgressSink.compose(target);
        int delivered = 0;
        BatchEvent event;
        while ((event = queue.poll()) != null) {
            event.deliverTo(guarded);
            delivered++;
        }
        return delivered;
    }

    /**
     * Delivers events to {@code target} on the calling thread until a batch-completed
     * event has been delivered, and returns its summary.
     */
    public BatchSummary dispatchUntilComplete(ProgressSink target) throws InterruptedException {
        ProgressSink guarded = ProgressSink.compose(target);
        while (true) {
            BatchEvent event = queue.take();
            event.deliverTo(guarded);
            if (event instanceof BatchCompletedEvent completed) {
                return completed.summary();
            }
        }
    }

    /**
     * Like {@link #dispatchUntilComplete(ProgressSink)} but gives up after {@code timeout}
     * without a completion event.
     */
    public Optional<BatchSummary> dispatchUntilComplete(ProgressSink target, Duration timeout)
            throws InterruptedException {
        ProgressSink guarded = ProgressSink.compose(target);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            BatchEvent event = queue.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            if (event == null) {
                return Optional.empty();
            }
            event.deliverTo(guarded);
            if (event instanceof BatchCompletedEvent completed) {
                return Optional.of(completed.summary());
            }
        }
    }

    public int pending() {
        return queue.size();
    }

    private interface BatchEvent {
        void deliverTo(ProgressSink target);
    }

    private record LogEvent(String message) implements BatchEvent {
        @Override
        public void deliverTo(ProgressSink target) {
            target.onLog(message);
        }
    }

    private record ItemCompletedEvent(TaskOutcome outcome, BatchProgress progress) implements BatchEvent {
        @Override
        public void deliverTo(ProgressSink target) {
            target.onItemCompleted(outcome, progress);
        }
    }

    private record BatchCompletedEvent(BatchSummary summary) implements BatchEvent {
        @Override
        public void deliverTo(ProgressSink target) {
            target.onBatchCompleted(summary);
        }
    }
}
