package com.scanq.scan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome reported by a scan operation.
 */
public record ScanResult(boolean success, String runId, String error, Map<String, Object> details) {

    public ScanResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ScanResult succeeded(String runId) {
        return new ScanResult(true, runId, null, Map.of());
    }

    public static ScanResult failed(String error) {
        return new ScanResult(false, null, error, Map.of());
    }
}
