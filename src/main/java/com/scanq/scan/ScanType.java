package com.scanq.scan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanType {
    PROFILING("profiling"),
    CHECKS("checks"),
    FULL("full"),
    ANOMALIES("anomalies");

    private final String value;

    ScanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScanType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scan type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScanType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scan type: " + value);
    }
}
