package com.example.imagetagger;

import java.time.Duration;
import java.time.Instant;

/**
 * Final counts delivered once per batch. A cancelled batch reports the counts it
 * had reached when it was cancelled.
 */
public record BatchSummary(
        long batchId,
        int total,
        int completed,
        int succeeded,
        int failed,
        boolean cancelled,
        Instant startedAt,
        Instant finishedAt
) {
    static BatchSummary of(long batchId, BatchProgress progress, boolean cancelled, Instant startedAt) {
        return new BatchSummary(
                batchId,
                progress.total(),
                progress.completed(),
                progress.succeeded(),
                progress.failed(),
                cancelled,
                startedAt,
                Instant.now()
        );
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
