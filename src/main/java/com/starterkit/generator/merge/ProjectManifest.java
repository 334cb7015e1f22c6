package com.starterkit.generator.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged backend package manifest.
 *
 * @param name                 the package name, set to the project name
 * @param dependencies         runtime dependencies, sorted by package name
 * @param devDependencies      dev dependencies, sorted by package name
 * @param scripts              scripts, base first then defaults
 * @param conflicts            packages declared with differing constraints
 * @param addedDependencies    runtime packages not present in the base manifest
 * @param addedDevDependencies dev packages not present in the base manifest
 * @param content              the serialized manifest, ending with a newline
 */
public record ProjectManifest(
        String name,
        Map<String, String> dependencies,
        Map<String, String> devDependencies,
        Map<String, String> scripts,
        List<VersionConflict> conflicts,
        List<String> addedDependencies,
        List<String> addedDevDependencies,
        String content
) {
    public ProjectManifest {
        dependencies = copy(dependencies);
        devDependencies = copy(devDependencies);
        scripts = copy(scripts);
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        addedDependencies = addedDependencies != null ? List.copyOf(addedDependencies) : List.of();
        addedDevDependencies = addedDevDependencies != null ? List.copyOf(addedDevDependencies) : List.of();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    private static Map<String, String> copy(Map<String, String> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}
