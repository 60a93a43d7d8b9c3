package com.scanq.queue;

/**
 * {@code total} counts pending and running jobs; jobs waiting out a retry backoff are reported
 * separately.
 */
public record QueueStats(int pending, int running, int retrying, int total) {
}
