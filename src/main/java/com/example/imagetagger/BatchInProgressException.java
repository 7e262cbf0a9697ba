package com.example.imagetagger;

import java.util.Locale;

/**
 * Raised when a batch is started while another one is still running.
 */
public class BatchInProgressException extends IllegalStateException {
    private final long runningBatchId;

    public BatchInProgressException(long runningBatchId, CoordinatorState state) {
        super("Batch " + runningBatchId + " is still " + state.name().toLowerCase(Locale.ROOT));
        this.runningBatchId = runningBatchId;
    }

    public long runningBatchId() {
        return runningBatchId;
    }
}
