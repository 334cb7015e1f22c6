package com.starterkit.generator.api;

import com.starterkit.generator.merge.VersionConflict;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one completed generation.
 *
 * @param projectName      the archive's root folder name
 * @param featureSlugs     every resolved feature slug, in resolution order
 * @param unresolvedSlugs  requested or required slugs missing from the catalog
 * @param versionConflicts package version disagreements found while merging the manifest
 * @param missingModels    schema models declared by feature mappings but absent from the merged schema
 * @param entries          archive entries written
 * @param bytesWritten     compressed bytes written to the sink
 * @param duration         wall-clock time of the generation
 */
public record GenerationResult(
        String projectName,
        List<String> featureSlugs,
        List<String> unresolvedSlugs,
        List<VersionConflict> versionConflicts,
        List<String> missingModels,
        long entries,
        long bytesWritten,
        Duration duration
) {
    public GenerationResult {
        featureSlugs = featureSlugs != null ? List.copyOf(featureSlugs) : List.of();
        unresolvedSlugs = unresolvedSlugs != null ? List.copyOf(unresolvedSlugs) : List.of();
        versionConflicts = versionConflicts != null ? List.copyOf(versionConflicts) : List.of();
        missingModels = missingModels != null ? List.copyOf(missingModels) : List.of();
    }
}
