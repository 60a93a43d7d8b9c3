package com.scanq.queue;

import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;

/**
 * What to enqueue. {@code scheduleId} is null for ad-hoc jobs; a null {@code maxRetries} falls
 * back to {@code scanq.queue.default-max-retries}.
 */
public record JobSpec(
        String scheduleId,
        ScanType scanType,
        ScanTarget target,
        JobPriority priority,
        Integer maxRetries,
        String triggeredBy) {

    public JobSpec {
        if (scanType == null) {
            throw new IllegalArgumentException("scanType must not be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        priority = priority == null ? JobPriority.NORMAL : priority;
    }

    public static JobSpec of(ScanType scanType, ScanTarget target, JobPriority priority) {
        return new JobSpec(null, scanType, target, priority, null, null);
    }
}
