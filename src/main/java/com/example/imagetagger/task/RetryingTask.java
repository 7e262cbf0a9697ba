package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-runs a delegate task while it fails with a retryable reason, pausing a fixed
 * delay between attempts. {@link FailureReason#UNEXPECTED} is returned immediately.
 */
public final class RetryingTask implements TaskUnit {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTask.class);

    private final TaskUnit delegate;
    private final int maxAttempts;
    private final Duration delay;

    public RetryingTask(TaskUnit delegate, int maxAttempts, Duration delay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = maxAttempts;
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    /**
     * Wraps {@code task} only when more than one attempt is requested.
     */
    public static TaskUnit wrap(TaskUnit task, int maxAttempts, Duration delay) {
        return maxAttempts <= 1 ? task : new RetryingTask(task, maxAttempts, delay);
    }

    @Override
    public TaskOutcome execute(WorkItem item) {
        List<RetryAttempt> failures = new ArrayList<>();
        for (int attempt = 1; ; attempt++) {
            TaskOutcome outcome = delegate.execute(item);
            if (outcome.isSuccess()) {
                return outcome.withFailedAttempts(failures);
            }
            FailureReason reason = outcome.getReason().orElseThrow();
            if (!reason.retryable() || attempt >= maxAttempts) {
                return outcome.withFailedAttempts(failures);
            }
            LOGGER.info("Attempt {}/{} failed for {}: {}", attempt, maxAttempts, item.path(), outcome.getDetail());
            if (!pause()) {
                LOGGER.warn("Interrupted before retrying {}", item.path());
                return outcome.withFailedAttempts(failures);
            }
            failures.add(new RetryAttempt(attempt, outcome.getFinishedAt(), reason, outcome.getDetail()));
        }
    }

    private boolean pause() {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
