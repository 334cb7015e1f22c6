package com.starterkit.generator.cdi;

import com.starterkit.generator.api.GenerationOptions;
import com.starterkit.generator.api.ProjectGenerator;
import com.starterkit.generator.catalog.CatalogCacheConfig;
import com.starterkit.generator.catalog.FeatureCatalog;
import com.starterkit.generator.merge.VersionConflictStrategy;
import com.starterkit.generator.metrics.MetricsService;
import com.starterkit.generator.tracing.OpenTelemetryTracingService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the project generator from MicroProfile Config properties.
 *
 * <p>The application supplies the {@link FeatureCatalog} bean (usually backed by its
 * database); everything else is configured here:</p>
 * <pre>
 * project-generator:
 *   repository-root: /srv/starter-repo
 *   compression-level: 9
 *   conflict-strategy: LAST_WINS
 *   cache:
 *     enabled: true
 * </pre>
 *
 * <p>A {@link MetricsService} bean, when present, receives the generator's metrics.</p>
 */
@ApplicationScoped
public class ProjectGeneratorProducer {

    private static final Logger log = LoggerFactory.getLogger(ProjectGeneratorProducer.class);

    // ── Template ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "project-generator.repository-root")
    String repositoryRoot;

    @Inject
    @ConfigProperty(name = "project-generator.template-root")
    Optional<String> templateRoot;

    @Inject
    @ConfigProperty(name = "project-generator.fallback-template-slug", defaultValue = "starter")
    String fallbackTemplateSlug;

    @Inject
    @ConfigProperty(name = "project-generator.product-name", defaultValue = "Starter Kit")
    String productName;

    @Inject
    @ConfigProperty(name = "project-generator.excluded-directories")
    Optional<List<String>> excludedDirectories;

    @Inject
    @ConfigProperty(name = "project-generator.excluded-files")
    Optional<List<String>> excludedFiles;

    @Inject
    @ConfigProperty(name = "project-generator.web-manifest-path")
    Optional<String> webManifestPath;

    @Inject
    @ConfigProperty(name = "project-generator.web-manifest-enabled", defaultValue = "true")
    boolean webManifestEnabled;

    // ── Archive ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "project-generator.compression-level", defaultValue = "9")
    int compressionLevel;

    @Inject
    @ConfigProperty(name = "project-generator.conflict-strategy", defaultValue = "LAST_WINS")
    String conflictStrategy;

    @Inject
    @ConfigProperty(name = "project-generator.stream-buffer-size", defaultValue = "65536")
    int streamBufferSize;

    @Inject
    @ConfigProperty(name = "project-generator.async.threads", defaultValue = "4")
    int asyncThreads;

    @Inject
    @ConfigProperty(name = "project-generator.async.timeout-ms", defaultValue = "120000")
    long asyncTimeoutMs;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "project-generator.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "project-generator.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "project-generator.cache.ttl-seconds", defaultValue = "60")
    int cacheTtlSeconds;

    // ── Tracing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "project-generator.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<MetricsService> metricsServices;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GenerationOptions generationOptions() {
        GenerationOptions.Builder builder = GenerationOptions.builder()
                .fallbackTemplateSlug(fallbackTemplateSlug)
                .productName(productName)
                .compressionLevel(compressionLevel)
                .conflictStrategy(VersionConflictStrategy.valueOf(conflictStrategy.trim().toUpperCase(Locale.ROOT)))
                .streamBufferSize(streamBufferSize)
                .asyncThreads(asyncThreads)
                .asyncTimeoutMs(asyncTimeoutMs);
        excludedDirectories.ifPresent(builder::excludedDirectories);
        excludedFiles.ifPresent(builder::excludedFiles);
        if (webManifestEnabled) {
            webManifestPath.ifPresent(builder::webManifestPath);
        } else {
            builder.withoutWebManifest();
        }
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public ProjectGenerator projectGenerator(FeatureCatalog catalog, GenerationOptions options) {
        Path repository = Path.of(repositoryRoot);
        log.info("Producing ProjectGenerator: repository={} templateRoot={} cache={}",
                repository, templateRoot.orElse("core/base-template"), cacheEnabled);

        ProjectGenerator.Builder builder = ProjectGenerator.builder()
                .catalog(catalog)
                .options(options)
                .catalogCache(cacheEnabled
                        ? new CatalogCacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CatalogCacheConfig.disabled());

        if (templateRoot.isPresent()) {
            builder.templateDirectory(repository, repository.resolve(templateRoot.get()));
        } else {
            builder.templateDirectory(repository);
        }

        if (metricsServices.isResolvable()) {
            builder.metricsService(metricsServices.get());
            log.info("Generator metrics enabled");
        }
        if (tracingEnabled) {
            builder.tracingService(OpenTelemetryTracingService.fromGlobal());
            log.info("Generator tracing enabled");
        }
        return builder.build();
    }

    public void closeGenerator(@Disposes ProjectGenerator generator) {
        log.info("Closing ProjectGenerator");
        generator.close();
    }
}
