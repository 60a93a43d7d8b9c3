package com.scanq.cache;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Builds {@code endpoint?a=1&b=2} with parameter names sorted, so equal parameter sets map to
     * the same key regardless of insertion order.
     */
    public static String of(String endpoint, Map<String, ?> params) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
        if (params == null || params.isEmpty()) {
            return endpoint;
        }
        String query = new TreeMap<>(params).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
        return endpoint + "?" + query;
    }
}
