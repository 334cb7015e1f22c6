package com.starterkit.generator.merge;

import java.util.List;
import java.util.Objects;

/**
 * A package declared with more than one version constraint during a manifest merge.
 *
 * @param packageName  the package name
 * @param selected     the constraint written to the manifest
 * @param alternatives the other constraints that were declared, in declaration order
 * @param dev          true if the conflict is among dev dependencies
 */
public record VersionConflict(String packageName, String selected, List<String> alternatives, boolean dev) {

    public VersionConflict {
        Objects.requireNonNull(packageName, "packageName is required");
        Objects.requireNonNull(selected, "selected is required");
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }
}
