package com.scanq.schedule;

import com.scanq.MutableClock;
import com.scanq.scan.ScanTarget;
import com.scanq.scan.ScanType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleResolverTest {

    private MutableClock clock;
    private ScheduleResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        resolver = new ScheduleResolver(clock);
    }

    @Test
    void dailyScheduleRollsOverToNextDayWhenTimeHasPassed() {
        String expression = resolver.toIntervalExpression("daily", "09:00", null);

        assertEquals("0 9 * * *", expression);
        assertEquals(OffsetDateTime.parse("2024-01-02T09:00:00Z"), resolver.nextRunTime(expression, "UTC"));
    }

    @Test
    void dailyScheduleFiresLaterTheSameDay() {
        assertEquals(OffsetDateTime.parse("2024-01-01T18:30:00Z"),
                resolver.nextRunTime(resolver.toIntervalExpression("daily", "18:30", null), "UTC"));
    }

    @Test
    void weeklyScheduleMapsDayNamesToCronNumbers() {
        String expression = resolver.toIntervalExpression("weekly", "08:30", List.of("Monday", "Friday"));

        assertEquals("30 8 * * 1,5", expression);
    }

    @Test
    void sundayMapsToZero() {
        assertEquals("0 7 * * 0,6",
                resolver.toIntervalExpression(RecurrenceType.WEEKLY, "07:00", List.of("sunday", "Sat")));
    }

    @Test
    void hourlyAndMonthlyExpressions() {
        assertEquals("0 * * * *", resolver.toIntervalExpression("hourly", null, null));
        assertEquals("15 6 1 * *", resolver.toIntervalExpression("monthly", "06:15", null));
    }

    @Test
    void nextHourlyRunIsStrictlyAfterNow() {
        assertEquals(OffsetDateTime.parse("2024-01-01T11:00:00Z"), resolver.nextRunTime("0 * * * *", "UTC"));
    }

    @Test
    void unsupportedOrIncompleteRecurrencesAreRejected() {
        assertThrows(UnsupportedScheduleTypeException.class,
                () -> resolver.toIntervalExpression("yearly", "09:00", null));
        assertThrows(UnsupportedScheduleTypeException.class,
                () -> resolver.toIntervalExpression("daily", null, null));
        assertThrows(UnsupportedScheduleTypeException.class,
                () -> resolver.toIntervalExpression("weekly", "09:00", List.of()));
        assertThrows(UnsupportedScheduleTypeException.class,
                () -> resolver.toIntervalExpression("none", "09:00", null));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.toIntervalExpression("weekly", "09:00", List.of("Funday")));
        assertThrows(IllegalArgumentException.class,
                () -> resolver.toIntervalExpression("daily", "25:00", null));
    }

    @Test
    void nextRunTimeHonoursTimezone() {
        // 09:00 in New York is 14:00 UTC in January
        assertEquals(OffsetDateTime.parse("2024-01-01T14:00:00Z"),
                resolver.nextRunTime("0 9 * * *", "America/New_York"));
    }

    @Test
    void dayOfMonthAndDayOfWeekMatchEitherWhenBothAreSet() {
        clock.set(OffsetDateTime.parse("2024-01-02T00:00:00Z").toInstant());

        assertEquals(OffsetDateTime.parse("2024-01-08T09:00:00Z"), resolver.nextRunTime("0 9 15 * 1", "UTC"));
        assertEquals(OffsetDateTime.parse("2024-01-15T09:00:00Z"),
                resolver.nextRunTime("0 9 15 * 1", "UTC", OffsetDateTime.parse("2024-01-08T09:00:00Z")));
        assertEquals(OffsetDateTime.parse("2024-01-15T09:00:00Z"), resolver.nextRunTime("0 9 15 * *", "UTC"));
        assertEquals(OffsetDateTime.parse("2024-01-08T09:00:00Z"), resolver.nextRunTime("0 9 * * 1", "UTC"));
    }

    @Test
    void invalidExpressionsAndZonesAreRejected() {
        assertThrows(InvalidExpressionException.class, () -> resolver.nextRunTime("not a cron", "UTC"));
        assertThrows(InvalidExpressionException.class, () -> resolver.nextRunTime("0 9 * *", "UTC"));
        assertThrows(InvalidExpressionException.class, () -> resolver.nextRunTime("0 9 * * *", "Mars/Olympus"));
        assertFalse(resolver.isValid("61 * * * *"));
        assertTrue(resolver.isValid(CronPresets.WEEKDAYS_9AM));
    }

    @Test
    void nextRunTimesAreConsecutive() {
        List<OffsetDateTime> times = resolver.nextRunTimes(CronPresets.EVERY_6_HOURS, 3, "UTC");

        assertThat(times).containsExactly(
                OffsetDateTime.parse("2024-01-01T12:00:00Z"),
                OffsetDateTime.parse("2024-01-01T18:00:00Z"),
                OffsetDateTime.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void describesCommonShapes() {
        assertEquals("Every hour at minute 0", resolver.describe("0 * * * *"));
        assertEquals("Daily at 09:05", resolver.describe("5 9 * * *"));
        assertEquals("Weekly on Monday, Friday at 08:30", resolver.describe("30 8 * * 1,5"));
        assertEquals("Every 5 minutes", resolver.describe("*/5 * * * *"));
        assertEquals("Every 2 hours at minute 0", resolver.describe("0 */2 * * *"));
        assertEquals("0 0 1 * *", resolver.describe("0 0 1 * *"));
        assertEquals("garbage", resolver.describe("garbage"));
    }

    @Test
    void isDueComparesAgainstClock() {
        assertTrue(resolver.isDue(OffsetDateTime.parse("2024-01-01T10:00:00Z")));
        assertTrue(resolver.isDue(OffsetDateTime.parse("2024-01-01T09:59:59Z")));
        assertFalse(resolver.isDue(OffsetDateTime.parse("2024-01-01T10:00:01Z")));
        assertFalse(resolver.isDue(null));
    }

    @Test
    void oneTimeScheduleFiresAtStartDateAndTime() {
        Schedule schedule = schedule(false, RecurrenceType.NONE, "14:30");
        schedule.setStartDate(LocalDate.of(2024, 1, 5));
        schedule.setTimezone("Europe/Berlin");

        assertEquals(OffsetDateTime.parse("2024-01-05T13:30:00Z"), resolver.nextRunFor(schedule));
    }

    @Test
    void oneTimeScheduleWithoutStartDateIsDueNow() {
        Schedule schedule = schedule(false, RecurrenceType.NONE, null);

        assertEquals(OffsetDateTime.parse("2024-01-01T10:00:00Z"), resolver.nextRunFor(schedule));
    }

    @Test
    void recurringScheduleWaitsForStartDate() {
        Schedule schedule = schedule(true, RecurrenceType.DAILY, "09:00");
        schedule.setStartDate(LocalDate.of(2024, 2, 1));

        assertEquals(OffsetDateTime.parse("2024-02-01T09:00:00Z"), resolver.nextRunFor(schedule));
    }

    @Test
    void recurringScheduleStopsAfterEndDate() {
        Schedule schedule = schedule(true, RecurrenceType.DAILY, "09:00");
        schedule.setEndDate(LocalDate.of(2024, 1, 1));

        assertNull(resolver.nextRunFor(schedule));

        schedule.setEndDate(LocalDate.of(2024, 1, 2));
        assertEquals(OffsetDateTime.parse("2024-01-02T09:00:00Z"), resolver.nextRunFor(schedule));
    }

    @Test
    void nextRunForFollowsClock() {
        Schedule schedule = schedule(true, RecurrenceType.HOURLY, null);

        clock.advance(Duration.ofMinutes(90));

        assertEquals(OffsetDateTime.parse("2024-01-01T12:00:00Z"), resolver.nextRunFor(schedule));
    }

    private static Schedule schedule(boolean recurring, RecurrenceType type, String time) {
        Schedule schedule = new Schedule("s-1", new ScanTarget("dq", "public", "orders"), ScanType.PROFILING);
        schedule.setRecurring(recurring);
        schedule.setRecurrenceType(type);
        schedule.setTimeOfDay(time);
        return schedule;
    }
}
