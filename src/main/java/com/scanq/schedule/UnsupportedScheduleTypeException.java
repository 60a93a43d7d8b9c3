package com.scanq.schedule;

public class UnsupportedScheduleTypeException extends IllegalArgumentException {

    public UnsupportedScheduleTypeException(String scheduleType) {
        super("Unsupported schedule type: " + scheduleType);
    }

    public UnsupportedScheduleTypeException(String scheduleType, String reason) {
        super("Unsupported schedule type: " + scheduleType + " (" + reason + ")");
    }
}
