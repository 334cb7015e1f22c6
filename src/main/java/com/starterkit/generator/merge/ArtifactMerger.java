package com.starterkit.generator.merge;

import com.starterkit.generator.core.model.EnvVarSpec;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.resolve.ResolvedFeatureSet;
import com.starterkit.generator.template.BaseTemplate;
import com.starterkit.generator.template.BaseTemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the manifest, schema and environment merges for a resolved feature set.
 * A web app manifest, when the template has one, is renamed to {@code <project>-web}.
 *
 * <p>Everything here happens before the archive stream is opened, so a missing or
 * malformed base manifest or schema aborts the generation without writing any output.</p>
 */
public class ArtifactMerger {
    private static final Logger log = LoggerFactory.getLogger(ArtifactMerger.class);

    static final String WEB_SUFFIX = "-web";

    private final BaseTemplate template;
    private final String manifestPath;
    private final String schemaPath;
    private final String webManifestPath;
    private final List<EnvVarSpec> baseEnvVars;
    private final ManifestMerger manifestMerger;
    private final SchemaMerger schemaMerger;
    private final EnvMerger envMerger;

    public ArtifactMerger(BaseTemplate template, String manifestPath, String schemaPath,
                          List<EnvVarSpec> baseEnvVars, VersionConflictStrategy conflictStrategy) {
        this(template, manifestPath, schemaPath, null, baseEnvVars, conflictStrategy);
    }

    /**
     * @param webManifestPath template path of the web app manifest to rename, or {@code null} to leave
     *                        it as the template has it
     */
    public ArtifactMerger(BaseTemplate template, String manifestPath, String schemaPath, String webManifestPath,
                          List<EnvVarSpec> baseEnvVars, VersionConflictStrategy conflictStrategy) {
        this.template = Objects.requireNonNull(template, "template is required");
        this.manifestPath = Objects.requireNonNull(manifestPath, "manifestPath is required");
        this.schemaPath = Objects.requireNonNull(schemaPath, "schemaPath is required");
        this.webManifestPath = webManifestPath;
        this.baseEnvVars = List.copyOf(baseEnvVars);
        this.manifestMerger = new ManifestMerger(conflictStrategy);
        this.schemaMerger = new SchemaMerger(template);
        this.envMerger = new EnvMerger();
    }

    /**
     * Merges all artifacts.
     *
     * @param projectName the generated project's name
     * @param resolved    the resolved feature set
     * @throws BaseTemplateException if the base manifest or schema is missing or unreadable
     */
    public MergedArtifacts merge(String projectName, ResolvedFeatureSet resolved) {
        List<Feature> features = resolved.features();

        String baseManifest = template.readFile(manifestPath)
                .orElseThrow(() -> new BaseTemplateException(
                        "Could not read base package.json: " + manifestPath + " not found in " + template.getRoot()));
        String baseSchema = template.readFile(schemaPath)
                .orElseThrow(() -> new BaseTemplateException(
                        "Could not read base schema: " + schemaPath + " not found in " + template.getRoot()));

        ProjectManifest manifest = manifestMerger.merge(baseManifest, projectName, features);
        MergedSchema schema = schemaMerger.merge(baseSchema, features);
        MergedEnvSpec env = envMerger.merge(baseEnvVars, features);
        ProjectManifest webManifest = mergeWebManifest(projectName);

        log.info("merge.completed project={} dependencies={} devDependencies={} conflicts={} models={} enums={} envVars={}",
                projectName, manifest.dependencies().size(), manifest.devDependencies().size(),
                manifest.conflicts().size(), schema.models().size(), schema.enums().size(), env.variables().size());

        return new MergedArtifacts(manifest, schema, env, webManifest);
    }

    // The web manifest is optional; a template without one keeps generating
    private ProjectManifest mergeWebManifest(String projectName) {
        if (webManifestPath == null) {
            return null;
        }
        Optional<String> content = template.readFile(webManifestPath);
        if (content.isEmpty()) {
            log.debug("merge.webManifestAbsent path={}", webManifestPath);
            return null;
        }
        try {
            return manifestMerger.rename(content.get(), projectName + WEB_SUFFIX);
        } catch (BaseTemplateException e) {
            log.warn("merge.webManifestSkipped path={} reason={}", webManifestPath, e.getMessage());
            return null;
        }
    }
}
