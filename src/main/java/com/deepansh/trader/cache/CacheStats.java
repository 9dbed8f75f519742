package com.deepansh.trader.cache;

public record CacheStats(int entries, long hits, long misses, long puts, long evictions) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
