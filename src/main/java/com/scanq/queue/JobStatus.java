package com.scanq.queue;

/**
 * {@code PENDING -> RUNNING -> COMPLETED | RETRYING | FAILED}; a {@code RETRYING} job returns to
 * {@code PENDING} once its backoff elapses.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
