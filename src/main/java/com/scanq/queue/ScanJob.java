package com.scanq.queue;

import com.scanq.error.ErrorKind;
import com.scanq.scan.ScanResult;
import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A queued scan. Instances held by {@link ScanJobQueue} are mutated only under the queue lock;
 * callers receive copies.
 */
public class ScanJob {

    private final UUID id;
    private final String scheduleId;
    private final ScanType scanType;
    private final ScanTarget target;
    private final JobPriority priority;
    private final int maxRetries;
    private final String triggeredBy;
    private final OffsetDateTime createdAt;

    private JobStatus status = JobStatus.PENDING;
    private int retryCount;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String error;
    private ErrorKind errorKind;
    private ScanResult result;

    ScanJob(UUID id, JobSpec spec, int maxRetries, String triggeredBy, OffsetDateTime createdAt) {
        this.id = id;
        this.scheduleId = spec.scheduleId();
        this.scanType = spec.scanType();
        this.target = spec.target();
        this.priority = spec.priority();
        this.maxRetries = maxRetries;
        this.triggeredBy = triggeredBy;
        this.createdAt = createdAt;
    }

    private ScanJob(ScanJob source) {
        this.id = source.id;
        this.scheduleId = source.scheduleId;
        this.scanType = source.scanType;
        this.target = source.target;
        this.priority = source.priority;
        this.maxRetries = source.maxRetries;
        this.triggeredBy = source.triggeredBy;
        this.createdAt = source.createdAt;
        this.status = source.status;
        this.retryCount = source.retryCount;
        this.startedAt = source.startedAt;
        this.completedAt = source.completedAt;
        this.error = source.error;
        this.errorKind = source.errorKind;
        this.result = source.result;
    }

    ScanJob copy() {
        return new ScanJob(this);
    }

    public UUID getId() {
        return id;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public ScanType getScanType() {
        return scanType;
    }

    public ScanTarget getTarget() {
        return target;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public ScanResult getResult() {
        return result;
    }

    void markRunning(OffsetDateTime now) {
        status = JobStatus.RUNNING;
        startedAt = now;
    }

    void markCompleted(ScanResult scanResult, OffsetDateTime now) {
        status = JobStatus.COMPLETED;
        result = scanResult;
        completedAt = now;
    }

    void markRetrying(String message, ErrorKind kind) {
        status = JobStatus.RETRYING;
        retryCount++;
        error = message;
        errorKind = kind;
    }

    void markPending() {
        status = JobStatus.PENDING;
    }

    void markFailed(String message, ErrorKind kind, OffsetDateTime now) {
        status = JobStatus.FAILED;
        error = message;
        errorKind = kind;
        completedAt = now;
    }

    boolean canRetry() {
        return retryCount < maxRetries;
    }

    @Override
    public String toString() {
        return "ScanJob{" + id + ", " + scanType.value() + " " + target + ", " + priority + ", " + status
                + ", retry " + retryCount + "/" + maxRetries + "}";
    }
}
