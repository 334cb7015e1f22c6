package com.starterkit.generator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named bundle that always includes a fixed set of features, whatever the buyer selected.
 */
public record Template(String name, String slug, List<String> includedFeatures) {

    public Template {
        Objects.requireNonNull(slug, "slug is required");
        name = name != null ? name : slug;
        includedFeatures = includedFeatures != null ? List.copyOf(includedFeatures) : List.of();
    }
}
