package com.example.imagetagger.task;

import java.time.Instant;

public class RetryAttempt {
    private final int attempt;
    private final Instant timestamp;
    private final FailureReason reason;
    private final String error;

    public RetryAttempt(int attempt, Instant timestamp, FailureReason reason, String error) {
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.reason = reason;
        this.error = error;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getError() {
        return error;
    }
}
