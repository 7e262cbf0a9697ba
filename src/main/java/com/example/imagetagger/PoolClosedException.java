package com.example.imagetagger;

import java.util.concurrent.RejectedExecutionException;

/**
 * Raised when a task is submitted to a {@link WorkerPool} that has been shut down.
 */
public class PoolClosedException extends RejectedExecutionException {
    public PoolClosedException(String message) {
        super(message);
    }

    public PoolClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
