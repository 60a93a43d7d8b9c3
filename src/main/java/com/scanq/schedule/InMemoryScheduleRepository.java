package com.scanq.schedule;

import com.scanq.scan.ScanTarget;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local {@link ScheduleRepository}. Stored schedules are copied on the way in and out.
 */
@Component
@ConditionalOnProperty(prefix = "scanq.schedules", name = "store", havingValue = "memory")
public class InMemoryScheduleRepository implements ScheduleRepository {

    private static final Comparator<OffsetDateTime> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private final Map<String, Schedule> schedules = new ConcurrentHashMap<>();

    @Override
    public List<Schedule> listDue(OffsetDateTime now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return schedules.values().stream()
                .filter(s -> s.getStatus() == ScheduleStatus.ACTIVE)
                .filter(s -> s.getNextRunAt() != null && !s.getNextRunAt().isAfter(now))
                .sorted(Comparator.comparing(Schedule::getNextRunAt))
                .limit(limit)
                .map(Schedule::copy)
                .toList();
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        Schedule schedule = schedules.get(scheduleId);
        return schedule == null ? Optional.empty() : Optional.of(schedule.copy());
    }

    @Override
    public List<Schedule> findByTable(ScanTarget target) {
        ScanTarget normalized = target.normalized();
        return schedules.values().stream()
                .filter(s -> s.getStatus() != ScheduleStatus.DELETED)
                .filter(s -> normalized.equals(s.getTarget()))
                .sorted(Comparator.comparing(Schedule::getCreatedAt, NULLS_FIRST).reversed())
                .map(Schedule::copy)
                .toList();
    }

    @Override
    public Schedule create(Schedule schedule) {
        if (schedule.getId() == null) {
            throw new IllegalArgumentException("Schedule id must not be null");
        }
        Schedule existing = schedules.putIfAbsent(schedule.getId(), schedule.copy());
        if (existing != null) {
            throw new IllegalArgumentException("Schedule already exists: " + schedule.getId());
        }
        return schedule.copy();
    }

    @Override
    public Schedule save(Schedule schedule) {
        if (schedule.getId() == null) {
            throw new IllegalArgumentException("Schedule id must not be null");
        }
        schedules.put(schedule.getId(), schedule.copy());
        return schedule.copy();
    }

    @Override
    public void markExecuted(String scheduleId, OffsetDateTime lastRunAt, OffsetDateTime nextRunAt) {
        update(scheduleId, s -> {
            s.setLastRunAt(lastRunAt);
            s.setNextRunAt(nextRunAt);
            s.setFailureCount(0);
            s.setLastError(null);
            s.setUpdatedAt(lastRunAt);
        });
    }

    @Override
    public int incrementFailure(String scheduleId, String error, OffsetDateTime failedAt) {
        return update(scheduleId, s -> {
            s.setFailureCount(s.getFailureCount() + 1);
            s.setLastError(error);
            s.setUpdatedAt(failedAt);
        }).getFailureCount();
    }

    @Override
    public void forceRunNow(String scheduleId, OffsetDateTime now) {
        update(scheduleId, s -> {
            s.setNextRunAt(now);
            s.setUpdatedAt(now);
        });
    }

    @Override
    public void updateStatus(String scheduleId, ScheduleStatus status, OffsetDateTime updatedAt) {
        update(scheduleId, s -> {
            s.setStatus(status);
            s.setUpdatedAt(updatedAt);
        });
    }

    private Schedule update(String scheduleId, Consumer<Schedule> mutation) {
        Schedule updated = schedules.computeIfPresent(scheduleId, (id, current) -> {
            Schedule copy = current.copy();
            mutation.accept(copy);
            return copy;
        });
        if (updated == null) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        return updated;
    }
}
