package com.example.imagetagger;

public enum CoordinatorState {
    IDLE,
    RUNNING,
    COMPLETING,
    COMPLETED;

    boolean acceptsNewBatch() {
        return this == IDLE || this == COMPLETED;
    }
}
