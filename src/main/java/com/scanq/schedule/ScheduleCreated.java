package com.scanq.schedule;

import java.time.OffsetDateTime;

public record ScheduleCreated(String scheduleId, String summary, OffsetDateTime nextRunAt) {
}
