package com.scanq.scan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input handed to a {@link ScanWorker}.
 *
 * @param target      table to scan
 * @param triggeredBy who initiated the scan, e.g. {@code scheduled} or {@code manual}
 * @param options     worker specific options such as {@code profile_level}
 */
public record ScanRequest(ScanTarget target, String triggeredBy, Map<String, Object> options) {

    public ScanRequest {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
