package com.starterkit.generator.merge;

import java.util.Objects;
import java.util.Optional;

/**
 * The derived manifest, schema and environment specification for one generation.
 *
 * @param webManifest the renamed web app manifest, or {@code null} when the template has none
 */
public record MergedArtifacts(ProjectManifest manifest, MergedSchema schema, MergedEnvSpec env,
                              ProjectManifest webManifest) {

    public MergedArtifacts {
        Objects.requireNonNull(manifest, "manifest is required");
        Objects.requireNonNull(schema, "schema is required");
        Objects.requireNonNull(env, "env is required");
    }

    public MergedArtifacts(ProjectManifest manifest, MergedSchema schema, MergedEnvSpec env) {
        this(manifest, schema, env, null);
    }

    public Optional<ProjectManifest> findWebManifest() {
        return Optional.ofNullable(webManifest);
    }
}
