package com.scanq.schedule;

import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaScheduleRepository.class)
class ScheduleJpaRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-01-01T10:00:00Z");

    @Autowired
    private JpaScheduleRepository repository;

    @Test
    void listDueFiltersByStatusAndTime() {
        repository.create(schedule("late", NOW.minusSeconds(1)));
        repository.create(schedule("early", NOW.minusHours(2)));
        repository.create(schedule("future", NOW.plusMinutes(5)));
        Schedule paused = schedule("paused", NOW.minusHours(1));
        paused.setStatus(ScheduleStatus.PAUSED);
        repository.create(paused);

        List<Schedule> due = repository.listDue(NOW, 5);

        assertThat(due).extracting(Schedule::getId).containsExactly("early", "late");
        assertThat(repository.listDue(NOW, 1)).hasSize(1);
    }

    @Test
    void markExecutedAndIncrementFailureUpdateRow() {
        repository.create(schedule("s-1", NOW));

        assertEquals(1, repository.incrementFailure("s-1", "Connection timeout", NOW));
        assertEquals(2, repository.incrementFailure("s-1", "Connection timeout", NOW));
        Schedule failed = repository.findById("s-1").orElseThrow();
        assertEquals("Connection timeout", failed.getLastError());

        repository.markExecuted("s-1", NOW, NOW.plusHours(1));

        Schedule executed = repository.findById("s-1").orElseThrow();
        assertEquals(0, executed.getFailureCount());
        assertNull(executed.getLastError());
        assertEquals(NOW.toInstant(), executed.getLastRunAt().toInstant());
        assertEquals(NOW.plusHours(1).toInstant(), executed.getNextRunAt().toInstant());
    }

    @Test
    void daysOfWeekRoundTripThroughColumn() {
        Schedule weekly = schedule("weekly", NOW);
        weekly.setRecurrenceType(RecurrenceType.WEEKLY);
        weekly.setTimeOfDay("08:30");
        weekly.setDaysOfWeek(List.of("Monday", "Friday"));
        repository.create(weekly);

        assertThat(repository.findById("weekly").orElseThrow().getDaysOfWeek()).containsExactly("Monday", "Friday");
    }

    @Test
    void softDeletedSchedulesAreHiddenFromTableListing() {
        repository.create(schedule("kept", NOW));
        repository.create(schedule("gone", NOW));
        repository.softDelete("gone", NOW);

        assertThat(repository.findByTable(new ScanTarget("dq", "public", "orders")))
                .extracting(Schedule::getId)
                .containsExactly("kept");
    }

    @Test
    void unknownIdsAreReported() {
        assertThrows(ScheduleNotFoundException.class, () -> repository.forceRunNow("missing", NOW));
        assertThrows(IllegalArgumentException.class, () -> {
            repository.create(schedule("dup", NOW));
            repository.create(schedule("dup", NOW));
        });
    }

    private static Schedule schedule(String id, OffsetDateTime nextRunAt) {
        Schedule schedule = new Schedule(id, new ScanTarget("DQ", "PUBLIC", "ORDERS"), ScanType.CHECKS);
        schedule.setRecurring(true);
        schedule.setRecurrenceType(RecurrenceType.HOURLY);
        schedule.setNextRunAt(nextRunAt);
        schedule.setCreatedAt(NOW);
        return schedule;
    }
}
