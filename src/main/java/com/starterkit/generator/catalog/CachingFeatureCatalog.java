package com.starterkit.generator.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.starterkit.generator.core.model.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Caffeine-backed decorator over a {@link FeatureCatalog}.
 * Caches each (tier, slug) lookup, including misses, so that concurrent generations
 * of similar orders do not hit the backing store for every BFS level.
 * Cache misses are fetched from the delegate in a single batched call.
 */
public class CachingFeatureCatalog implements FeatureCatalog {
    private static final Logger log = LoggerFactory.getLogger(CachingFeatureCatalog.class);

    private final FeatureCatalog delegate;
    private final Cache<CacheKey, Optional<Feature>> cache;

    public CachingFeatureCatalog(FeatureCatalog delegate, CatalogCacheConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingFeatureCatalog initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public List<Feature> findFeaturesByTierAndSlugs(String tier, Collection<String> slugs) {
        List<Feature> result = new ArrayList<>();
        Set<String> misses = new LinkedHashSet<>();

        for (String slug : slugs) {
            Optional<Feature> cached = cache.getIfPresent(new CacheKey(tier, slug));
            if (cached == null) {
                misses.add(slug);
            } else {
                cached.ifPresent(result::add);
            }
        }

        if (!misses.isEmpty()) {
            List<Feature> fetched = delegate.findFeaturesByTierAndSlugs(tier, misses);
            Map<String, Feature> bySlug = new HashMap<>();
            for (Feature feature : fetched) {
                bySlug.put(feature.getSlug(), feature);
            }
            for (String slug : misses) {
                Feature feature = bySlug.get(slug);
                cache.put(new CacheKey(tier, slug), Optional.ofNullable(feature));
                if (feature != null) {
                    result.add(feature);
                }
            }
            log.debug("Catalog cache miss tier={} slugs={} found={}", tier, misses, bySlug.size());
        }
        return result;
    }

    /**
     * Drops every cached lookup, e.g. after the catalog was edited.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all catalog cache entries");
    }

    public CatalogCacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CatalogCacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String tier, String slug) {}
}
