package com.scanq.cache;

import java.util.List;

public record CacheStats(int size, List<String> keys, long hits, long misses) {
}
