package com.starterkit.generator.api;

import com.starterkit.generator.archive.ArchiveAssembler;
import com.starterkit.generator.archive.ArchivePlan;
import com.starterkit.generator.archive.ArchiveStats;
import com.starterkit.generator.archive.ArchiveWriteException;
import com.starterkit.generator.archive.ProgressCallback;
import com.starterkit.generator.catalog.CachingFeatureCatalog;
import com.starterkit.generator.catalog.CatalogCacheConfig;
import com.starterkit.generator.catalog.FeatureCatalog;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.Order;
import com.starterkit.generator.core.model.SchemaMapping;
import com.starterkit.generator.core.model.Template;
import com.starterkit.generator.document.DescriptorGenerator;
import com.starterkit.generator.document.DocumentContext;
import com.starterkit.generator.document.DocumentGenerator;
import com.starterkit.generator.document.EnvTemplateGenerator;
import com.starterkit.generator.document.GeneratedDocument;
import com.starterkit.generator.document.LicenseGenerator;
import com.starterkit.generator.document.ReadmeGenerator;
import com.starterkit.generator.logging.LogContext;
import com.starterkit.generator.merge.ArtifactMerger;
import com.starterkit.generator.merge.MergedArtifacts;
import com.starterkit.generator.metrics.MetricsService;
import com.starterkit.generator.metrics.NoOpMetricsService;
import com.starterkit.generator.resolve.DependencyResolver;
import com.starterkit.generator.resolve.ResolvedFeatureSet;
import com.starterkit.generator.template.BaseTemplate;
import com.starterkit.generator.template.FileSystemBaseTemplate;
import com.starterkit.generator.template.PathSanitizer;
import com.starterkit.generator.tracing.NoOpTracingService;
import com.starterkit.generator.tracing.Span;
import com.starterkit.generator.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for generating starter projects.
 *
 * <p>For each order the generator resolves the feature closure, merges the package manifest,
 * database schema and environment specification, renders the generated documents and streams
 * the result as a ZIP archive whose single top-level folder is the project name.
 * Generations share no mutable state and may run concurrently.</p>
 *
 * <pre>
 * try (ProjectGenerator generator = ProjectGenerator.builder()
 *         .catalog(catalog)
 *         .templateDirectory(Path.of("/srv/starter-repo"))
 *         .build()) {
 *     GenerationResult result = generator.generate(order, response.getOutputStream());
 * }
 * </pre>
 *
 * <p>Configuration and input errors are raised before the first byte is written. Once
 * writing has started, any failure leaves an incomplete archive in the sink that the
 * caller must discard.</p>
 */
public class ProjectGenerator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProjectGenerator.class);

    static final String SPAN_GENERATE = "generator.generate";
    static final String SPAN_RESOLVE = "generator.resolve";
    static final String SPAN_MERGE = "generator.merge";
    static final String SPAN_ARCHIVE = "generator.archive";

    private final FeatureCatalog catalog;
    private final BaseTemplate template;
    private final GenerationOptions options;
    private final DependencyResolver resolver;
    private final ArtifactMerger artifactMerger;
    private final ArchiveAssembler assembler;
    private final List<DocumentGenerator> documentGenerators;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService streamExecutor;

    private ProjectGenerator(Builder builder) {
        this.options = builder.options;
        this.template = builder.template;
        this.catalog = builder.cacheConfig != null && builder.cacheConfig.enabled()
                ? new CachingFeatureCatalog(builder.catalog, builder.cacheConfig)
                : builder.catalog;
        this.resolver = new DependencyResolver(catalog);
        this.artifactMerger = new ArtifactMerger(template, options.getManifestPath(), options.getSchemaPath(),
                options.getWebManifestPath().orElse(null), options.getBaseEnvVars(), options.getConflictStrategy());
        this.assembler = new ArchiveAssembler(template, options.pathFilter(),
                options.getCompressionLevel(), options.getCopyBufferSize());

        List<DocumentGenerator> generators = new ArrayList<>();
        generators.add(new EnvTemplateGenerator(options.getEnvTemplatePath()));
        generators.add(new ReadmeGenerator(options.getReadmePath()));
        generators.add(new LicenseGenerator(options.getLicensePath()));
        generators.add(new DescriptorGenerator(options.getDescriptorPath()));
        generators.addAll(builder.extraDocumentGenerators);
        this.documentGenerators = List.copyOf(generators);

        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.streamExecutor = Executors.newFixedThreadPool(options.getAsyncThreads(),
                new GeneratorThreads("project-generator-stream"));

        log.info("Project generator initialized: template={}, conflictStrategy={}, cache={}",
                template.getRoot(), options.getConflictStrategy(),
                catalog instanceof CachingFeatureCatalog ? "enabled" : "disabled");
    }

    /**
     * Name of the archive's root folder: the template slug, or the fallback slug when the
     * order has no template, joined to the tier with a hyphen.
     */
    public String projectName(Order order) {
        String slug = order.getTemplate().map(Template::slug).orElse(options.getFallbackTemplateSlug());
        String name = slug + "-" + order.getTier();
        if (!PathSanitizer.normalizeEntryName(name, "project name").equals(name) || name.contains("/")) {
            throw new IllegalArgumentException("Project name is not a valid folder name: '" + name + "'");
        }
        return name;
    }

    /**
     * Resolves the order's selected and template features to a dependency-closed set.
     */
    public ResolvedFeatureSet resolveFeatures(Order order) {
        return resolver.resolveFeatures(order.getSelectedFeatures(), order.getTier(), order.getTemplateFeatures());
    }

    /**
     * Generates the project archive for an order into the sink.
     * The sink is flushed but not closed.
     *
     * @throws com.starterkit.generator.template.BaseTemplateException on configuration or input errors,
     *                                                                   before anything is written
     * @throws ArchiveWriteException if writing fails part-way; the sink content must be discarded
     */
    public GenerationResult generate(Order order, OutputStream sink) {
        return generate(order, sink, ProgressCallback.NOOP);
    }

    public GenerationResult generate(Order order, OutputStream sink, ProgressCallback progress) {
        Objects.requireNonNull(order, "order is required");
        Objects.requireNonNull(sink, "sink is required");
        long startNanos = System.nanoTime();

        try (LogContext ctx = LogContext.forGeneration(
                LogContext.generateCorrelationId(), order.getOrderNumber(), order.getTier());
             Span span = tracingService.startSpan(SPAN_GENERATE, spanAttributes(order))) {
            try {
                PreparedGeneration prepared = prepare(order, span);
                GenerationResult result = write(prepared, sink, progress, startNanos, span);
                span.setAttribute("archive.entries", result.entries());
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                recordFailure(order, e);
                throw e;
            }
        }
    }

    /**
     * Starts a generation and returns the archive as a stream to read from.
     *
     * <p>Resolution and merging run on the calling thread, so configuration and input errors are
     * thrown from this method. The archive is then written on a worker thread through a bounded
     * pipe; the worker blocks while the reader falls behind. A failure while writing is reported
     * as an {@link IOException} from {@code read}.</p>
     */
    public InputStream openStream(Order order) {
        Objects.requireNonNull(order, "order is required");
        long startNanos = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();

        // Ended by the writer task, or here if the stream never starts
        Span span = tracingService.startSpan(SPAN_GENERATE, spanAttributes(order));
        span.setAttribute("stream", "piped");

        PreparedGeneration prepared;
        PipedOutputStream pipeOut;
        GenerationInputStream stream;
        try (LogContext ctx = LogContext.forGeneration(correlationId, order.getOrderNumber(), order.getTier())) {
            try {
                prepared = prepare(order, span);
                PipedInputStream pipeIn = new PipedInputStream(options.getStreamBufferSize());
                pipeOut = openPipe(pipeIn);
                stream = new GenerationInputStream(pipeIn);
            } catch (RuntimeException e) {
                span.fail(e);
                span.close();
                recordFailure(order, e);
                throw e;
            }
        }

        try {
            streamExecutor.execute(() -> {
                try (LogContext ctx = LogContext.forGeneration(correlationId, order.getOrderNumber(), order.getTier())
                        .with("stage", "stream")) {
                    try {
                        GenerationResult result = write(prepared, pipeOut, ProgressCallback.NOOP, startNanos, span);
                        span.setAttribute("archive.entries", result.entries());
                        span.setStatus(Span.SpanStatus.OK);
                    } catch (RuntimeException e) {
                        span.fail(e);
                        recordFailure(order, e);
                        stream.fail(e);
                    } finally {
                        closePipe(pipeOut);
                        span.close();
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            GenerationException failure = new GenerationException("Generator is closed", e);
            span.fail(failure);
            span.close();
            closePipe(pipeOut);
            recordFailure(order, failure);
            throw failure;
        }
        return stream;
    }

    /**
     * Creates an {@link AsyncProjectGenerator} running generations on a bounded thread pool.
     */
    public AsyncProjectGenerator async() {
        return new AsyncProjectGeneratorImpl(this, options);
    }

    public FeatureCatalog getCatalog() {
        return catalog;
    }

    public BaseTemplate getTemplate() {
        return template;
    }

    public GenerationOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        streamExecutor.shutdown();
        try {
            if (!streamExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                streamExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            streamExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private PreparedGeneration prepare(Order order, Span root) {
        log.info("generate.starting selected={} templateFeatures={}",
                order.getSelectedFeatures().size(), order.getTemplateFeatures().size());
        Instant generatedAt = options.getClock().instant();
        String projectName = projectName(order);

        ResolvedFeatureSet resolved;
        try (Span span = root.startChild(SPAN_RESOLVE, Map.of("tier", order.getTier()))) {
            resolved = resolveFeatures(order);
            span.setAttribute("features.resolved", resolved.size());
            span.setAttribute("features.unresolved", resolved.unresolvedSlugs().size());
        }
        metricsService.recordFeaturesResolved(resolved.size(), resolved.unresolvedSlugs().size());

        MergedArtifacts merged;
        List<GeneratedDocument> documents;
        ArchivePlan plan;
        try (Span span = root.startChild(SPAN_MERGE, Map.of("project", projectName))) {
            merged = artifactMerger.merge(projectName, resolved);
            documents = renderDocuments(new DocumentContext(order, resolved, merged, projectName,
                    options.getProductName(), generatedAt), merged);
            plan = assembler.plan(projectName, resolved, documents);
            span.setAttribute("version.conflicts", merged.manifest().conflicts().size());
            span.setAttribute("archive.planned", plan.entries().size());
        }
        metricsService.incrementVersionConflicts(merged.manifest().conflicts().size());

        List<String> missingModels = merged.schema().validateCompleteness(requiredModels(resolved));
        if (!missingModels.isEmpty()) {
            log.warn("generate.schemaIncomplete missingModels={}", missingModels);
        }
        return new PreparedGeneration(order, resolved, merged, plan, missingModels);
    }

    private GenerationResult write(PreparedGeneration prepared, OutputStream sink,
                                   ProgressCallback progress, long startNanos, Span root) {
        ArchiveStats stats;
        try (Span span = root.startChild(SPAN_ARCHIVE, Map.of("project", prepared.plan().rootFolder()))) {
            try {
                stats = assembler.write(prepared.plan(), sink, progress);
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
            span.setAttribute("archive.entries", stats.entries());
            span.setAttribute("archive.bytes", stats.bytesWritten());
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordArchiveEntries(stats.entries());
        metricsService.recordArchiveBytes(stats.bytesWritten());
        metricsService.recordGenerationDuration(prepared.order().getTier(), duration);

        log.info("generate.completed project={} features={} entries={} bytes={} durationMs={}",
                stats.rootFolder(), prepared.resolved().size(), stats.entries(), stats.bytesWritten(),
                duration.toMillis());

        return new GenerationResult(stats.rootFolder(), prepared.resolved().allFeatureSlugs(),
                prepared.resolved().unresolvedSlugs(), prepared.merged().manifest().conflicts(),
                prepared.missingModels(), stats.entries(), stats.bytesWritten(), duration);
    }

    private List<GeneratedDocument> renderDocuments(DocumentContext context, MergedArtifacts merged) {
        List<GeneratedDocument> documents = new ArrayList<>();
        documents.add(new GeneratedDocument(options.getManifestPath(), merged.manifest().content()));
        documents.add(new GeneratedDocument(options.getSchemaPath(), merged.schema().text()));
        merged.findWebManifest().ifPresent(web ->
                documents.add(new GeneratedDocument(options.getWebManifestPath().orElseThrow(), web.content())));
        for (DocumentGenerator generator : documentGenerators) {
            documents.add(generator.generate(context));
        }
        return documents;
    }

    private static List<String> requiredModels(ResolvedFeatureSet resolved) {
        Set<String> models = new LinkedHashSet<>();
        for (Feature feature : resolved.features()) {
            for (SchemaMapping mapping : feature.getSchemaMappings()) {
                models.add(mapping.model());
            }
        }
        return new ArrayList<>(models);
    }

    private void recordFailure(Order order, RuntimeException e) {
        metricsService.incrementGenerationFailed(order.getTier(), e.getClass().getSimpleName());
        log.error("generate.failed orderNumber={} tier={} errorType={} message={}",
                order.getOrderNumber(), order.getTier(), e.getClass().getSimpleName(), e.getMessage(), e);
    }

    private static Map<String, String> spanAttributes(Order order) {
        return Map.of("order.number", order.getOrderNumber(), "tier", order.getTier());
    }

    private static PipedOutputStream openPipe(PipedInputStream in) {
        try {
            return new PipedOutputStream(in);
        } catch (IOException e) {
            throw new ArchiveWriteException("Failed to open archive stream", null, e);
        }
    }

    private static void closePipe(PipedOutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.warn("generate.streamCloseFailed error={}", e.getMessage());
        }
    }

    private record PreparedGeneration(Order order, ResolvedFeatureSet resolved, MergedArtifacts merged,
                                      ArchivePlan plan, List<String> missingModels) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FeatureCatalog catalog;
        private BaseTemplate template;
        private GenerationOptions options = GenerationOptions.defaults();
        private CatalogCacheConfig cacheConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private final List<DocumentGenerator> extraDocumentGenerators = new ArrayList<>();

        public Builder catalog(FeatureCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder baseTemplate(BaseTemplate template) {
            this.template = template;
            return this;
        }

        /**
         * Uses the template at {@code core/base-template} inside a repository checkout.
         */
        public Builder templateDirectory(Path repositoryRoot) {
            this.template = FileSystemBaseTemplate.inRepository(repositoryRoot);
            return this;
        }

        public Builder templateDirectory(Path repositoryRoot, Path templateRoot) {
            this.template = new FileSystemBaseTemplate(repositoryRoot, templateRoot);
            return this;
        }

        public Builder options(GenerationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Wraps the catalog in a Caffeine-backed cache.
         */
        public Builder catalogCache(CatalogCacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Adds a document rendered after the built-in ones; it replaces any file at the same path.
         */
        public Builder documentGenerator(DocumentGenerator generator) {
            this.extraDocumentGenerators.add(Objects.requireNonNull(generator, "generator is required"));
            return this;
        }

        public ProjectGenerator build() {
            if (catalog == null) {
                throw new IllegalStateException("FeatureCatalog is required");
            }
            if (template == null) {
                throw new IllegalStateException("BaseTemplate is required");
            }
            return new ProjectGenerator(this);
        }
    }
}
