package com.starterkit.generator.catalog;

/**
 * Snapshot of catalog cache statistics.
 */
public record CatalogCacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
