package com.scanq.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scanq.scan.ScanType;

import java.util.UUID;

/**
 * Outcome of one due schedule within a driver tick. {@code jobId} is set when the schedule was
 * handed to the job queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleRun(
        String scheduleId,
        ScanType scanType,
        String table,
        RunStatus status,
        String runId,
        UUID jobId,
        String error) {

    static ScheduleRun completed(String scheduleId, ScanType scanType, String table, String runId) {
        return new ScheduleRun(scheduleId, scanType, table, RunStatus.COMPLETED, runId, null, null);
    }

    static ScheduleRun failed(String scheduleId, ScanType scanType, String table, String error) {
        return new ScheduleRun(scheduleId, scanType, table, RunStatus.FAILED, null, null, error);
    }

    static ScheduleRun skipped(String scheduleId, ScanType scanType, String table, String reason) {
        return new ScheduleRun(scheduleId, scanType, table, RunStatus.SKIPPED, null, null, reason);
    }

    static ScheduleRun enqueued(String scheduleId, ScanType scanType, String table, UUID jobId) {
        return new ScheduleRun(scheduleId, scanType, table, RunStatus.ENQUEUED, null, jobId, null);
    }
}
