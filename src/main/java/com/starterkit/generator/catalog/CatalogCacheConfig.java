package com.starterkit.generator.catalog;

/**
 * Configuration for the catalog lookup cache.
 *
 * @param maxSize    maximum number of cached (tier, slug) lookups
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CatalogCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CatalogCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 5,000 entries, 60s TTL, enabled.
     */
    public static CatalogCacheConfig defaults() {
        return new CatalogCacheConfig(5_000, 60, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CatalogCacheConfig disabled() {
        return new CatalogCacheConfig(1, 1, false);
    }
}
