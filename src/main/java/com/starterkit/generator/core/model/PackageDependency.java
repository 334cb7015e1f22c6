package com.starterkit.generator.core.model;

import java.util.Objects;

/**
 * External package a feature needs in the generated project's manifest.
 *
 * @param name    package name
 * @param version version constraint (e.g. "^9.0.2")
 * @param dev     true for development-only dependencies
 */
public record PackageDependency(String name, String version, boolean dev) {

    public PackageDependency {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(version, "version is required");
    }

    public static PackageDependency runtime(String name, String version) {
        return new PackageDependency(name, version, false);
    }

    public static PackageDependency dev(String name, String version) {
        return new PackageDependency(name, version, true);
    }
}
