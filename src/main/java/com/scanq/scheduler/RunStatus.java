package com.scanq.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    COMPLETED,
    FAILED,
    SKIPPED,
    ENQUEUED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
