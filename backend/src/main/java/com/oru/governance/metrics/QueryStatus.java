package com.oru.governance.metrics;

/**
 * Lifecycle of one historical query inside a batch.
 * Every state except PENDING is terminal.
 */
public enum QueryStatus {
    PENDING,
    SUCCEEDED,
    EMPTY,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
