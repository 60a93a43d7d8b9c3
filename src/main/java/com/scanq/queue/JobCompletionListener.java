package com.scanq.queue;

/**
 * Notified once per job when it reaches {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED}.
 * Invoked on a queue worker thread outside the queue lock.
 */
@FunctionalInterface
public interface JobCompletionListener {

    void onJobFinished(ScanJob job);
}
