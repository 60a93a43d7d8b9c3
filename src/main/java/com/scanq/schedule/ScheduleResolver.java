package com.scanq.schedule;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns recurrence descriptions into 5-field cron expressions (minute, hour, day-of-month,
 * month, day-of-week with Sunday as 0) and evaluates them against the injected {@link Clock}.
 * Returned instants are expressed in UTC.
 */
@Component
public class ScheduleResolver {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final String[] DAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private final Clock clock;

    public ScheduleResolver(Clock clock) {
        this.clock = clock;
    }

    public OffsetDateTime nextRunTime(String expression, String timezone) {
        return nextRunTime(expression, timezone, OffsetDateTime.now(clock));
    }

    /**
     * Earliest instant strictly after {@code after} at which the expression fires in the zone.
     * When both day-of-month and day-of-week are restricted, a day matching either field fires.
     */
    public OffsetDateTime nextRunTime(String expression, String timezone, OffsetDateTime after) {
        List<CronExpression> alternatives = parse(expression);
        ZoneId zone = resolveZone(expression, timezone);
        ZonedDateTime start = after.atZoneSameInstant(zone);
        ZonedDateTime next = null;
        for (CronExpression cron : alternatives) {
            ZonedDateTime candidate = cron.next(start);
            if (candidate != null && (next == null || candidate.isBefore(next))) {
                next = candidate;
            }
        }
        if (next == null) {
            throw new InvalidExpressionException(expression);
        }
        return next.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    }

    public List<OffsetDateTime> nextRunTimes(String expression, int count, String timezone) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        List<OffsetDateTime> times = new ArrayList<>(count);
        OffsetDateTime cursor = OffsetDateTime.now(clock);
        for (int i = 0; i < count; i++) {
            cursor = nextRunTime(expression, timezone, cursor);
            times.add(cursor);
        }
        return times;
    }

    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidExpressionException e) {
            return false;
        }
    }

    public String toIntervalExpression(String recurrenceType, String timeOfDay, List<String> daysOfWeek) {
        return toIntervalExpression(RecurrenceType.fromValue(recurrenceType), timeOfDay, daysOfWeek);
    }

    public String toIntervalExpression(RecurrenceType recurrenceType, String timeOfDay, List<String> daysOfWeek) {
        if (recurrenceType == null) {
            throw new UnsupportedScheduleTypeException("null");
        }
        switch (recurrenceType) {
            case HOURLY:
                return "0 * * * *";
            case DAILY: {
                LocalTime time = requireTime(recurrenceType, timeOfDay);
                return time.getMinute() + " " + time.getHour() + " * * *";
            }
            case WEEKLY: {
                LocalTime time = requireTime(recurrenceType, timeOfDay);
                if (daysOfWeek == null || daysOfWeek.isEmpty()) {
                    throw new UnsupportedScheduleTypeException("weekly", "days of week are required");
                }
                return time.getMinute() + " " + time.getHour() + " * * " + toDayNumbers(daysOfWeek);
            }
            case MONTHLY: {
                LocalTime time = requireTime(recurrenceType, timeOfDay);
                return time.getMinute() + " " + time.getHour() + " 1 * *";
            }
            default:
                throw new UnsupportedScheduleTypeException(recurrenceType.name().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Human-readable form of the common shapes; anything else is echoed back.
     */
    public String describe(String expression) {
        if (expression == null) {
            return null;
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            return expression;
        }
        String minute = parts[0];
        String hour = parts[1];
        String dayOfMonth = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4];
        boolean everyDay = "*".equals(dayOfMonth) && "*".equals(month);

        if (minute.startsWith("*/") && "*".equals(hour)) {
            return "Every " + minute.substring(2) + " minutes";
        }
        if (hour.startsWith("*/") && isNumber(minute)) {
            return "Every " + hour.substring(2) + " hours at minute " + minute;
        }
        if (isNumber(minute) && "*".equals(hour) && everyDay && "*".equals(dayOfWeek)) {
            return "Every hour at minute " + minute;
        }
        if (isNumber(minute) && isNumber(hour) && everyDay) {
            String at = pad(hour) + ":" + pad(minute);
            if ("*".equals(dayOfWeek)) {
                return "Daily at " + at;
            }
            return "Weekly on " + describeDays(dayOfWeek) + " at " + at;
        }
        return expression;
    }

    public boolean isDue(OffsetDateTime nextRunAt) {
        return nextRunAt != null && !OffsetDateTime.now(clock).isBefore(nextRunAt);
    }

    /**
     * Next instant a schedule should fire, or {@code null} when it has none left. One-time
     * schedules fire at {@code startDate} + {@code timeOfDay} (now when no start date is set);
     * recurring schedules never fire before their start date nor after their end date.
     */
    public OffsetDateTime nextRunFor(Schedule schedule) {
        ZoneId zone = resolveZone("schedule " + schedule.getId(), schedule.getTimezone());
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (!schedule.isRecurring() || schedule.getRecurrenceType() == RecurrenceType.NONE) {
            if (schedule.getStartDate() == null) {
                return now.withOffsetSameInstant(ZoneOffset.UTC);
            }
            LocalTime time = schedule.getTimeOfDay() == null ? LocalTime.MIDNIGHT : parseTime(schedule.getTimeOfDay());
            return schedule.getStartDate().atTime(time).atZone(zone).toOffsetDateTime()
                    .withOffsetSameInstant(ZoneOffset.UTC);
        }

        String expression = toIntervalExpression(schedule.getRecurrenceType(), schedule.getTimeOfDay(),
                schedule.getDaysOfWeek());
        OffsetDateTime after = now;
        LocalDate startDate = schedule.getStartDate();
        if (startDate != null) {
            // the first fire may land exactly at midnight of the start date
            OffsetDateTime startOfWindow = startDate.atStartOfDay(zone).toOffsetDateTime().minusNanos(1);
            if (startOfWindow.isAfter(after)) {
                after = startOfWindow;
            }
        }
        OffsetDateTime next = nextRunTime(expression, schedule.getTimezone(), after);
        LocalDate endDate = schedule.getEndDate();
        if (endDate != null && next.atZoneSameInstant(zone).toLocalDate().isAfter(endDate)) {
            return null;
        }
        return next;
    }

    // Spring matches day-of-month AND day-of-week; 5-field cron matches either when both are set
    private List<CronExpression> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException(String.valueOf(expression));
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidExpressionException(expression);
        }
        try {
            if (isUnrestricted(fields[2]) || isUnrestricted(fields[4])) {
                return List.of(toSpringCron(fields));
            }
            String[] byDayOfMonth = fields.clone();
            byDayOfMonth[4] = "*";
            String[] byDayOfWeek = fields.clone();
            byDayOfWeek[2] = "*";
            return List.of(toSpringCron(byDayOfMonth), toSpringCron(byDayOfWeek));
        } catch (IllegalArgumentException e) {
            throw new InvalidExpressionException(expression, e);
        }
    }

    private static CronExpression toSpringCron(String[] fields) {
        return CronExpression.parse("0 " + String.join(" ", fields));
    }

    private static boolean isUnrestricted(String field) {
        return field.startsWith("*") || field.equals("?");
    }

    private ZoneId resolveZone(String context, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidExpressionException(context + " (unknown timezone " + timezone + ")", e);
        }
    }

    private LocalTime requireTime(RecurrenceType recurrenceType, String timeOfDay) {
        if (timeOfDay == null || timeOfDay.isBlank()) {
            throw new UnsupportedScheduleTypeException(recurrenceType.name().toLowerCase(Locale.ROOT),
                    "time of day is required");
        }
        return parseTime(timeOfDay);
    }

    private LocalTime parseTime(String timeOfDay) {
        Matcher matcher = TIME_OF_DAY.matcher(timeOfDay.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time of day '" + timeOfDay + "', expected HH:mm");
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    private String toDayNumbers(List<String> daysOfWeek) {
        Set<Integer> numbers = new LinkedHashSet<>();
        for (String day : daysOfWeek) {
            numbers.add(toDayNumber(day));
        }
        return numbers.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private int toDayNumber(String day) {
        if (day == null || day.isBlank()) {
            throw new IllegalArgumentException("Day of week must not be blank");
        }
        String normalized = day.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek candidate : DayOfWeek.values()) {
            if (candidate.name().equals(normalized) || candidate.name().substring(0, 3).equals(normalized)) {
                return candidate.getValue() % 7;
            }
        }
        throw new IllegalArgumentException("Unknown day of week: " + day);
    }

    private String describeDays(String dayOfWeek) {
        List<String> names = new ArrayList<>();
        for (String token : dayOfWeek.split(",")) {
            if (isNumber(token)) {
                int index = Integer.parseInt(token);
                names.add(index >= 0 && index <= 7 ? DAY_NAMES[index % 7] : token);
            } else {
                names.add(token);
            }
        }
        return String.join(", ", names);
    }

    private static boolean isNumber(String value) {
        return NUMBER.matcher(value).matches();
    }

    private static String pad(String value) {
        return value.length() == 1 ? "0" + value : value;
    }
}
