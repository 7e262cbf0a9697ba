package com.example.imagetagger.task;

public enum FailureReason {
    /** The generator failed or produced no metadata. */
    GENERATION_ERROR,
    /** Metadata was produced but could not be written. */
    WRITE_ERROR,
    /** Anything else thrown while processing the item. */
    UNEXPECTED;

    boolean retryable() {
        return this != UNEXPECTED;
    }
}
