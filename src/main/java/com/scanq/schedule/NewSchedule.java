package com.scanq.schedule;

import com.scanq.scan.ScanType;

import java.time.LocalDate;
import java.util.List;

/**
 * Payload for creating a schedule. {@code scheduleType} is one of
 * {@code hourly|daily|weekly|monthly}; one-time schedules leave {@code recurring} false and
 * fire at {@code startDate} + {@code scheduleTime}.
 */
public record NewSchedule(
        String database,
        String schema,
        String table,
        ScanType scanType,
        boolean recurring,
        String scheduleType,
        String scheduleTime,
        List<String> scheduleDays,
        String timezone,
        LocalDate startDate,
        LocalDate endDate,
        boolean skipIfRunning,
        OnFailureAction onFailureAction,
        Integer maxFailures,
        String createdBy) {
}
