package com.starterkit.generator.catalog;

import com.starterkit.generator.core.model.Feature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory catalog.
 * Features can be restricted to a set of tiers; unrestricted features are offered in every tier.
 * Thread-safe: the backing maps are never modified after {@link Builder#build()}.
 */
public class InMemoryFeatureCatalog implements FeatureCatalog {

    private final Map<String, Feature> features;
    private final Map<String, Set<String>> tierRestrictions;

    private InMemoryFeatureCatalog(Builder builder) {
        this.features = Map.copyOf(builder.features);
        this.tierRestrictions = Map.copyOf(builder.tierRestrictions);
    }

    @Override
    public List<Feature> findFeaturesByTierAndSlugs(String tier, Collection<String> slugs) {
        List<Feature> result = new ArrayList<>();
        for (String slug : slugs) {
            Feature feature = features.get(slug);
            if (feature == null || !feature.isActive()) {
                continue;
            }
            Set<String> tiers = tierRestrictions.get(slug);
            if (tiers != null && !tiers.contains(tier)) {
                continue;
            }
            result.add(feature);
        }
        return result;
    }

    public int size() {
        return features.size();
    }

    public static InMemoryFeatureCatalog of(Feature... features) {
        Builder builder = builder();
        for (Feature feature : features) {
            builder.add(feature);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Feature> features = new LinkedHashMap<>();
        private final Map<String, Set<String>> tierRestrictions = new LinkedHashMap<>();

        /**
         * Adds a feature available in every tier. A later feature with the same slug replaces the earlier one.
         */
        public Builder add(Feature feature) {
            features.put(feature.getSlug(), feature);
            tierRestrictions.remove(feature.getSlug());
            return this;
        }

        /**
         * Adds a feature available only in the given tiers.
         */
        public Builder add(Feature feature, String... tiers) {
            features.put(feature.getSlug(), feature);
            tierRestrictions.put(feature.getSlug(), Set.of(tiers));
            return this;
        }

        public Builder addAll(Collection<Feature> features) {
            features.forEach(this::add);
            return this;
        }

        public InMemoryFeatureCatalog build() {
            return new InMemoryFeatureCatalog(this);
        }
    }
}
