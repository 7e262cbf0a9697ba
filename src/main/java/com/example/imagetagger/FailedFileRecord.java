package com.example.imagetagger;

import com.example.imagetagger.task.FailureReason;
import com.example.imagetagger.task.RetryAttempt;
import com.example.imagetagger.task.TaskOutcome;

import java.time.Instant;
import java.util.List;

public class FailedFileRecord {
    private final String path;
    private final FailureReason reason;
    private final String detail;
    private final int attempts;
    private final Instant lastAttemptTime;
    private final List<RetryAttempt> retryAttempts;

    public FailedFileRecord(String path,
                            FailureReason reason,
                            String detail,
                            int attempts,
                            Instant lastAttemptTime,
                            List<RetryAttempt> retryAttempts) {
        this.path = path;
        this.reason = reason;
        this.detail = detail;
        this.attempts = attempts;
        this.lastAttemptTime = lastAttemptTime;
        this.retryAttempts = retryAttempts;
    }

    static FailedFileRecord from(TaskOutcome outcome) {
        return new FailedFileRecord(
                outcome.getItem().path().toString(),
                outcome.getReason().orElseThrow(),
                outcome.getDetail(),
                outcome.getAttempts(),
                outcome.getFinishedAt(),
                outcome.getFailedAttempts()
        );
    }

    public String getPath() {
        return path;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }
}
