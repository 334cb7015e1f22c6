package com.starterkit.generator.resolve;

import com.starterkit.generator.catalog.FeatureCatalog;
import com.starterkit.generator.core.model.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the transitive closure of required features for an order.
 *
 * <p>The {@code requires} graph lives in the catalog, not in memory, so it is discovered
 * level by level: the frontier starts as the union of selected and template slugs, each
 * level is looked up in one catalog query, and the {@code requires} of every feature found
 * become the next level. A slug is marked visited before it is enqueued, so it is never
 * queried twice and cycles terminate without special handling.</p>
 *
 * <p>Slugs with no active catalog entry are dropped from the closure and reported in
 * {@link ResolvedFeatureSet#unresolvedSlugs()}; they never fail the resolution.</p>
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final FeatureCatalog catalog;

    public DependencyResolver(FeatureCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
    }

    /**
     * Resolves the selected and template-bundled slugs to a dependency-closed feature set.
     *
     * @param selectedSlugs         slugs the buyer selected
     * @param tier                  pricing tier, passed to the catalog for availability gating
     * @param templateIncludedSlugs slugs bundled by the order's template (may be empty)
     * @return the resolved set; empty when nothing resolvable was requested
     */
    public ResolvedFeatureSet resolveFeatures(List<String> selectedSlugs, String tier,
                                              List<String> templateIncludedSlugs) {
        Set<String> visited = new HashSet<>();
        List<String> frontier = new ArrayList<>();
        enqueue(selectedSlugs, visited, frontier);
        enqueue(templateIncludedSlugs, visited, frontier);

        if (frontier.isEmpty()) {
            log.debug("resolve.empty tier={}", tier);
            return ResolvedFeatureSet.empty();
        }

        Map<String, Feature> resolved = new LinkedHashMap<>();
        Map<String, List<String>> dependencyTree = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>();
        int level = 0;

        while (!frontier.isEmpty()) {
            Map<String, Feature> found = lookup(tier, frontier);
            List<String> next = new ArrayList<>();

            // Preserve frontier order so discovery order is deterministic
            for (String slug : frontier) {
                Feature feature = found.get(slug);
                if (feature == null) {
                    unresolved.add(slug);
                    continue;
                }
                resolved.put(slug, feature);
                dependencyTree.put(slug, feature.getRequires());
                enqueue(feature.getRequires(), visited, next);
            }

            log.debug("resolve.level level={} queried={} found={} next={}",
                    level, frontier.size(), found.size(), next.size());
            frontier = next;
            level++;
        }

        if (!unresolved.isEmpty()) {
            log.warn("resolve.unresolved tier={} slugs={}", tier, unresolved);
        }
        log.info("resolve.completed tier={} features={} unresolved={} levels={}",
                tier, resolved.size(), unresolved.size(), level);

        return new ResolvedFeatureSet(
                new ArrayList<>(resolved.values()),
                new ArrayList<>(resolved.keySet()),
                dependencyTree,
                new ArrayList<>(unresolved));
    }

    private Map<String, Feature> lookup(String tier, List<String> slugs) {
        Map<String, Feature> bySlug = new HashMap<>();
        for (Feature feature : catalog.findFeaturesByTierAndSlugs(tier, slugs)) {
            // Inactive entries never enter the closure
            if (feature.isActive()) {
                bySlug.put(feature.getSlug(), feature);
            }
        }
        return bySlug;
    }

    private static void enqueue(List<String> slugs, Set<String> visited, List<String> target) {
        if (slugs == null) {
            return;
        }
        for (String slug : slugs) {
            if (slug == null || slug.isBlank()) {
                continue;
            }
            if (visited.add(slug)) {
                target.add(slug);
            }
        }
    }
}
