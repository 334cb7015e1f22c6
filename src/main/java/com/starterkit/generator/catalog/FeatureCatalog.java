package com.starterkit.generator.catalog;

import com.starterkit.generator.core.model.Feature;

import java.util.Collection;
import java.util.List;

/**
 * Read-only access to the feature catalog.
 * Implementations must be safe for concurrent reads; the generator never writes to the catalog.
 */
public interface FeatureCatalog {

    /**
     * Finds the active features matching the given slugs that are available for the tier.
     * Unknown, inactive or tier-gated slugs are simply absent from the result.
     *
     * @param tier  pricing tier of the order
     * @param slugs slugs to look up
     * @return matching active features, in no particular order
     */
    List<Feature> findFeaturesByTierAndSlugs(String tier, Collection<String> slugs);
}
