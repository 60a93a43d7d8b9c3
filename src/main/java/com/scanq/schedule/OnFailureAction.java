package com.scanq.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the scheduler driver does once a schedule has failed {@code maxFailures} times in a row.
 */
public enum OnFailureAction {

    /**
     * Keep the schedule active; it stays due and is attempted again on the next tick.
     */
    CONTINUE,

    /**
     * Move the schedule to {@link ScheduleStatus#PAUSED}.
     */
    PAUSE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OnFailureAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONTINUE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown on-failure action: " + value, e);
        }
    }
}
