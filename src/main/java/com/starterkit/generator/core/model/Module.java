package com.starterkit.generator.core.model;

import java.util.Objects;

/**
 * Organizational grouping of related features.
 * The category tag is only used to group features in generated documents.
 *
 * @param slug     unique module identifier (e.g. "payments")
 * @param name     display name
 * @param category lowercase category tag (e.g. "core", "monetization", "storage")
 */
public record Module(String slug, String name, String category) {

    public Module {
        Objects.requireNonNull(slug, "slug is required");
        name = name != null ? name : slug;
        category = category != null && !category.isBlank() ? category : "other";
    }
}
