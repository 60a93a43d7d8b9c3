package com.scanq.schedule;

import com.scanq.scan.ScanTarget;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(prefix = "scanq.schedules", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaScheduleRepository implements ScheduleRepository {

    private final ScheduleJpaRepository jpaRepository;

    public JpaScheduleRepository(ScheduleJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Schedule> listDue(OffsetDateTime now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jpaRepository.findDue(now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Schedule> findById(String scheduleId) {
        return jpaRepository.findById(scheduleId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Schedule> findByTable(ScanTarget target) {
        ScanTarget normalized = target.normalized();
        return jpaRepository.findByTable(normalized.database(), normalized.schema(), normalized.table());
    }

    @Override
    @Transactional
    public Schedule create(Schedule schedule) {
        if (schedule.getId() != null && jpaRepository.existsById(schedule.getId())) {
            throw new IllegalArgumentException("Schedule already exists: " + schedule.getId());
        }
        return jpaRepository.save(schedule);
    }

    @Override
    @Transactional
    public Schedule save(Schedule schedule) {
        return jpaRepository.save(schedule);
    }

    @Override
    @Transactional
    public void markExecuted(String scheduleId, OffsetDateTime lastRunAt, OffsetDateTime nextRunAt) {
        requireUpdated(jpaRepository.markExecuted(scheduleId, lastRunAt, nextRunAt), scheduleId);
    }

    @Override
    @Transactional
    public int incrementFailure(String scheduleId, String error, OffsetDateTime failedAt) {
        requireUpdated(jpaRepository.incrementFailure(scheduleId, error, failedAt), scheduleId);
        return jpaRepository.findFailureCount(scheduleId);
    }

    @Override
    @Transactional
    public void forceRunNow(String scheduleId, OffsetDateTime now) {
        requireUpdated(jpaRepository.forceRunNow(scheduleId, now), scheduleId);
    }

    @Override
    @Transactional
    public void updateStatus(String scheduleId, ScheduleStatus status, OffsetDateTime updatedAt) {
        requireUpdated(jpaRepository.updateStatus(scheduleId, status, updatedAt), scheduleId);
    }

    private static void requireUpdated(int updated, String scheduleId) {
        if (updated == 0) {
            throw new ScheduleNotFoundException(scheduleId);
        }
    }
}
