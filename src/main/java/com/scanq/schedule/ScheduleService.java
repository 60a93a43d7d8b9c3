package com.scanq.schedule;

import com.scanq.scan.ScanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Schedule management: creation with an initial {@code nextRunAt}, pause/resume, soft delete and
 * manual run-now.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository repository;
    private final ScheduleResolver resolver;
    private final Clock clock;

    public ScheduleService(ScheduleRepository repository, ScheduleResolver resolver, Clock clock) {
        this.repository = repository;
        this.resolver = resolver;
        this.clock = clock;
    }

    public ScheduleCreated create(NewSchedule request) {
        if (request == null) {
            throw new IllegalArgumentException("Schedule request must not be null");
        }
        if (request.scanType() == null) {
            throw new IllegalArgumentException("scanType is required");
        }
        if (request.maxFailures() != null && request.maxFailures() < 1) {
            throw new IllegalArgumentException("maxFailures must be >= 1");
        }
        if (request.startDate() != null && request.endDate() != null
                && request.endDate().isBefore(request.startDate())) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Schedule schedule = new Schedule(UUID.randomUUID().toString(),
                new ScanTarget(request.database(), request.schema(), request.table()), request.scanType());
        schedule.setRecurring(request.recurring());
        if (request.recurring()) {
            RecurrenceType type = RecurrenceType.fromValue(request.scheduleType());
            if (type == RecurrenceType.NONE) {
                throw new UnsupportedScheduleTypeException("none", "recurring schedules need a recurrence");
            }
            schedule.setRecurrenceType(type);
        } else {
            schedule.setRecurrenceType(RecurrenceType.NONE);
        }
        schedule.setTimeOfDay(request.scheduleTime());
        schedule.setDaysOfWeek(request.scheduleDays());
        schedule.setTimezone(request.timezone());
        schedule.setStartDate(request.startDate());
        schedule.setEndDate(request.endDate());
        schedule.setSkipIfRunning(request.skipIfRunning());
        schedule.setOnFailureAction(request.onFailureAction());
        schedule.setMaxFailures(request.maxFailures() == null ? Schedule.DEFAULT_MAX_FAILURES : request.maxFailures());
        schedule.setCreatedBy(request.createdBy());
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        schedule.setNextRunAt(resolver.nextRunFor(schedule));

        Schedule created = repository.create(schedule);
        String summary = summarize(created);
        log.info("Created schedule {} for {} ({}), next run at {}", created.getId(), created.getTarget(), summary,
                created.getNextRunAt());
        return new ScheduleCreated(created.getId(), summary, created.getNextRunAt());
    }

    public Schedule get(String scheduleId) {
        return repository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    public List<Schedule> listForTable(ScanTarget target) {
        return repository.findByTable(target);
    }

    public void pause(String scheduleId) {
        repository.updateStatus(scheduleId, ScheduleStatus.PAUSED, OffsetDateTime.now(clock));
        log.info("Paused schedule {}", scheduleId);
    }

    /**
     * Reactivates a schedule, clears its failure streak and recomputes when it fires next.
     */
    public Schedule resume(String scheduleId) {
        Schedule schedule = get(scheduleId);
        if (schedule.getStatus() == ScheduleStatus.DELETED) {
            throw new IllegalArgumentException("Deleted schedule " + scheduleId + " cannot be resumed");
        }
        schedule.setStatus(ScheduleStatus.ACTIVE);
        schedule.setFailureCount(0);
        schedule.setLastError(null);
        schedule.setNextRunAt(resolver.nextRunFor(schedule));
        schedule.setUpdatedAt(OffsetDateTime.now(clock));
        Schedule saved = repository.save(schedule);
        log.info("Resumed schedule {}, next run at {}", scheduleId, saved.getNextRunAt());
        return saved;
    }

    public void softDelete(String scheduleId) {
        repository.softDelete(scheduleId, OffsetDateTime.now(clock));
        log.info("Deleted schedule {}", scheduleId);
    }

    public void runNow(String scheduleId) {
        repository.forceRunNow(scheduleId, OffsetDateTime.now(clock));
        log.info("Schedule {} marked for immediate execution", scheduleId);
    }

    /**
     * Applies a status change ({@code active} resumes) and/or a run-now request.
     */
    public void update(String scheduleId, ScheduleStatus status, boolean forceRunNow) {
        if (status == ScheduleStatus.ACTIVE) {
            resume(scheduleId);
        } else if (status == ScheduleStatus.PAUSED) {
            pause(scheduleId);
        } else if (status == ScheduleStatus.DELETED) {
            softDelete(scheduleId);
        }
        if (forceRunNow) {
            runNow(scheduleId);
        }
    }

    public String summarize(Schedule schedule) {
        String zone = schedule.getTimezone();
        if (!schedule.isRecurring() || schedule.getRecurrenceType() == RecurrenceType.NONE) {
            String date = schedule.getStartDate() == null ? "first tick" : schedule.getStartDate().toString();
            String time = schedule.getTimeOfDay() == null ? "" : " at " + schedule.getTimeOfDay();
            return "One-time on " + date + time + " " + zone;
        }
        return switch (schedule.getRecurrenceType()) {
            case HOURLY -> "Every hour";
            case DAILY -> "Daily at " + schedule.getTimeOfDay() + " " + zone;
            case WEEKLY -> "Weekly on " + String.join(", ", schedule.getDaysOfWeek()) + " at "
                    + schedule.getTimeOfDay() + " " + zone;
            case MONTHLY -> "Monthly on day 1 at " + schedule.getTimeOfDay() + " " + zone;
            case NONE -> "Runs once";
        };
    }
}
