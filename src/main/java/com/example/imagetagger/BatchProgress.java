package com.example.imagetagger;

/**
 * Point-in-time counters of a running batch. {@code succeeded + failed == completed}
 * always holds for a snapshot.
 */
public record BatchProgress(
        int total,
        int completed,
        int succeeded,
        int failed
) {
    public boolean isFinished() {
        return completed == total;
    }

    /**
     * Fraction of items completed, 1.0 for an empty batch.
     */
    public double fraction() {
        return total == 0 ? 1.0 : (double) completed / total;
    }
}
