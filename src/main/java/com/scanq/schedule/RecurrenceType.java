package com.scanq.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecurrenceType {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    NONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup of {@code hourly|daily|weekly|monthly|none}.
     */
    @JsonCreator
    public static RecurrenceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedScheduleTypeException(String.valueOf(value));
        }
        try {
            return RecurrenceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedScheduleTypeException(value);
        }
    }
}
