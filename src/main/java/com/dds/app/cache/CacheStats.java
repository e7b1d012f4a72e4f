package com.dds.app.cache;

public record CacheStats(long totalEntries, long completed, long incomplete, long withMatches, long errors) {

    public double hitRate() {
        return totalEntries == 0 ? 0.0 : (completed * 100.0) / totalEntries;
    }
}
