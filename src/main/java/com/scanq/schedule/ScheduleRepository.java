package com.scanq.schedule;

import com.scanq.scan.ScanTarget;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for {@link Schedule}s. Mutating operations throw
 * {@link ScheduleNotFoundException} when the id is unknown.
 */
public interface ScheduleRepository {

    /**
     * Active schedules with {@code nextRunAt <= now}, earliest first, at most {@code limit}.
     */
    List<Schedule> listDue(OffsetDateTime now, int limit);

    Optional<Schedule> findById(String scheduleId);

    /**
     * Schedules of a table that are not deleted, newest first.
     */
    List<Schedule> findByTable(ScanTarget target);

    Schedule create(Schedule schedule);

    Schedule save(Schedule schedule);

    /**
     * Records a successful run: sets {@code lastRunAt} and {@code nextRunAt}, resets the failure
     * counter and clears the last error.
     */
    void markExecuted(String scheduleId, OffsetDateTime lastRunAt, OffsetDateTime nextRunAt);

    /**
     * Increments the failure counter and records the error. {@code nextRunAt} is left untouched.
     *
     * @return the new failure count
     */
    int incrementFailure(String scheduleId, String error, OffsetDateTime failedAt);

    void forceRunNow(String scheduleId, OffsetDateTime now);

    void updateStatus(String scheduleId, ScheduleStatus status, OffsetDateTime updatedAt);

    default void softDelete(String scheduleId, OffsetDateTime deletedAt) {
        updateStatus(scheduleId, ScheduleStatus.DELETED, deletedAt);
    }
}
