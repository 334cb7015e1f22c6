package com.starterkit.generator.resolve;

import com.starterkit.generator.core.model.Feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-closed, deduplicated set of features computed for one order.
 * Recomputed for every generation and never persisted.
 *
 * @param features        one entry per resolved feature, in discovery order
 * @param allFeatureSlugs slug of every resolved feature, including ones pulled in only as dependencies
 * @param dependencyTree  declared {@code requires} of every resolved feature, keyed by slug
 * @param unresolvedSlugs requested or required slugs with no active catalog entry, in discovery order
 */
public record ResolvedFeatureSet(
        List<Feature> features,
        List<String> allFeatureSlugs,
        Map<String, List<String>> dependencyTree,
        List<String> unresolvedSlugs
) {
    public ResolvedFeatureSet {
        features = features != null ? List.copyOf(features) : List.of();
        allFeatureSlugs = allFeatureSlugs != null ? List.copyOf(allFeatureSlugs) : List.of();
        dependencyTree = dependencyTree != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencyTree)) : Map.of();
        unresolvedSlugs = unresolvedSlugs != null ? List.copyOf(unresolvedSlugs) : List.of();
    }

    /**
     * The empty set; a valid input for the rest of the pipeline (base-template-only project).
     */
    public static ResolvedFeatureSet empty() {
        return new ResolvedFeatureSet(List.of(), List.of(), Map.of(), List.of());
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public int size() {
        return features.size();
    }

    public boolean contains(String slug) {
        return allFeatureSlugs.contains(slug);
    }
}
