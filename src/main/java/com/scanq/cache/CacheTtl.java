package com.scanq.cache;

/**
 * TTL tiers, in seconds, chosen by callers of {@link ResultCache}.
 */
public final class CacheTtl {

    /** Frequently changing metrics. */
    public static final long QUICK_METRICS = 30;

    public static final long KPI_METRICS = 60;

    public static final long REFERENCE_DATA = 300;

    public static final long STATIC_DATA = 3600;

    private CacheTtl() {
    }
}
