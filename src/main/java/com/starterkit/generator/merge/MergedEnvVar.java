package com.starterkit.generator.merge;

import java.util.List;
import java.util.Objects;

/**
 * One environment variable after merging every declaration of its key.
 *
 * @param key          the variable name
 * @param description  first non-blank description declared for the key
 * @param required     true if any declaration marks it required
 * @param defaultValue first non-null default declared, or null
 * @param fromBase     true if the base template declares it
 * @param features     names of the features that declare it, in resolution order
 */
public record MergedEnvVar(
        String key,
        String description,
        boolean required,
        String defaultValue,
        boolean fromBase,
        List<String> features
) {
    public MergedEnvVar {
        Objects.requireNonNull(key, "key is required");
        description = description != null ? description : "";
        features = features != null ? List.copyOf(features) : List.of();
    }

    /**
     * The feature the variable is listed under in the rendered template, or null for base variables.
     */
    public String owningFeature() {
        return fromBase || features.isEmpty() ? null : features.get(0);
    }
}
