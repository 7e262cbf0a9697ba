package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one {@link WorkItem}: success, or a failure with its reason.
 * Instances are immutable and may be handed between threads freely.
 */
public final class TaskOutcome {
    private final WorkItem item;
    private final FailureReason reason;
    private final String detail;
    private final Instant finishedAt;
    private final List<RetryAttempt> failedAttempts;

    private TaskOutcome(WorkItem item,
                        FailureReason reason,
                        String detail,
                        Instant finishedAt,
                        List<RetryAttempt> failedAttempts) {
        this.item = Objects.requireNonNull(item, "item");
        this.reason = reason;
        this.detail = detail;
        this.finishedAt = finishedAt;
        this.failedAttempts = List.copyOf(failedAttempts);
    }

    public static TaskOutcome success(WorkItem item) {
        return new TaskOutcome(item, null, null, Instant.now(), List.of());
    }

    public static TaskOutcome failure(WorkItem item, FailureReason reason, String detail) {
        return new TaskOutcome(item, Objects.requireNonNull(reason, "reason"), detail, Instant.now(), List.of());
    }

    /**
     * Returns a copy carrying the attempts that failed before this outcome was produced.
     */
    public TaskOutcome withFailedAttempts(List<RetryAttempt> attempts) {
        return new TaskOutcome(item, reason, detail, finishedAt, attempts);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public WorkItem getItem() {
        return item;
    }

    public Optional<FailureReason> getReason() {
        return Optional.ofNullable(reason);
    }

    public String getDetail() {
        return detail;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public List<RetryAttempt> getFailedAttempts() {
        return failedAttempts;
    }

    /**
     * Total attempts made for the item, including the one that produced this outcome.
     */
    public int getAttempts() {
        return failedAttempts.size() + 1;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Success[" + item.path() + "]";
        }
        return "Failure[" + item.path() + ", " + reason + (detail == null ? "" : ", " + detail) + "]";
    }
}
