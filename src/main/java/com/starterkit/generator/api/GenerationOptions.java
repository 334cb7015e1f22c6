package com.starterkit.generator.api;

import com.starterkit.generator.archive.ZipArchiveWriter;
import com.starterkit.generator.core.model.EnvVarSpec;
import com.starterkit.generator.document.DescriptorGenerator;
import com.starterkit.generator.document.EnvTemplateGenerator;
import com.starterkit.generator.document.LicenseGenerator;
import com.starterkit.generator.document.ReadmeGenerator;
import com.starterkit.generator.merge.EnvMerger;
import com.starterkit.generator.merge.VersionConflictStrategy;
import com.starterkit.generator.template.PathFilter;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Options for project generation.
 * Configures archive naming, compression, conflict policy, exclusions and output locations.
 */
public class GenerationOptions {

    private static final String DEFAULT_FALLBACK_TEMPLATE_SLUG = "starter";
    private static final String DEFAULT_PRODUCT_NAME = "Starter Kit";
    private static final int DEFAULT_COMPRESSION_LEVEL = 9;
    private static final int DEFAULT_STREAM_BUFFER_SIZE = 64 * 1024;
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 120_000;
    private static final int DEFAULT_ASYNC_THREADS = 4;

    private final String fallbackTemplateSlug;
    private final String productName;
    private final int compressionLevel;
    private final int copyBufferSize;
    private final int streamBufferSize;
    private final VersionConflictStrategy conflictStrategy;
    private final Set<String> excludedDirectories;
    private final Set<String> excludedFiles;
    private final String manifestPath;
    private final String schemaPath;
    private final String webManifestPath;
    private final String envTemplatePath;
    private final String readmePath;
    private final String licensePath;
    private final String descriptorPath;
    private final List<EnvVarSpec> baseEnvVars;
    private final Clock clock;
    private final long asyncTimeoutMs;
    private final int asyncThreads;

    private GenerationOptions(Builder builder) {
        this.fallbackTemplateSlug = builder.fallbackTemplateSlug;
        this.productName = builder.productName;
        this.compressionLevel = builder.compressionLevel;
        this.copyBufferSize = builder.copyBufferSize;
        this.streamBufferSize = builder.streamBufferSize;
        this.conflictStrategy = builder.conflictStrategy;
        this.excludedDirectories = Set.copyOf(builder.excludedDirectories);
        this.excludedFiles = Set.copyOf(builder.excludedFiles);
        this.manifestPath = builder.manifestPath;
        this.schemaPath = builder.schemaPath;
        this.webManifestPath = builder.webManifestPath;
        this.envTemplatePath = builder.envTemplatePath;
        this.readmePath = builder.readmePath;
        this.licensePath = builder.licensePath;
        this.descriptorPath = builder.descriptorPath;
        this.baseEnvVars = List.copyOf(builder.baseEnvVars);
        this.clock = builder.clock;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
        this.asyncThreads = builder.asyncThreads;
    }

    /**
     * Template slug used in the root folder name when the order has no template.
     */
    public String getFallbackTemplateSlug() {
        return fallbackTemplateSlug;
    }

    public String getProductName() {
        return productName;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public int getCopyBufferSize() {
        return copyBufferSize;
    }

    /**
     * Size of the pipe between the writer thread and the reader of {@link ProjectGenerator#openStream}.
     */
    public int getStreamBufferSize() {
        return streamBufferSize;
    }

    public VersionConflictStrategy getConflictStrategy() {
        return conflictStrategy;
    }

    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public Set<String> getExcludedFiles() {
        return excludedFiles;
    }

    public PathFilter pathFilter() {
        return PathFilter.of(excludedDirectories, excludedFiles);
    }

    public String getManifestPath() {
        return manifestPath;
    }

    public String getSchemaPath() {
        return schemaPath;
    }

    /**
     * Template path of the web app manifest renamed to {@code <project>-web}, empty when disabled.
     */
    public Optional<String> getWebManifestPath() {
        return Optional.ofNullable(webManifestPath);
    }

    public String getEnvTemplatePath() {
        return envTemplatePath;
    }

    public String getReadmePath() {
        return readmePath;
    }

    public String getLicensePath() {
        return licensePath;
    }

    public String getDescriptorPath() {
        return descriptorPath;
    }

    /**
     * Environment variables the base backend declares, rendered first in the env template.
     */
    public List<EnvVarSpec> getBaseEnvVars() {
        return baseEnvVars;
    }

    public Clock getClock() {
        return clock;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getAsyncThreads() {
        return asyncThreads;
    }

    /**
     * Creates default options.
     */
    public static GenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String fallbackTemplateSlug = DEFAULT_FALLBACK_TEMPLATE_SLUG;
        private String productName = DEFAULT_PRODUCT_NAME;
        private int compressionLevel = DEFAULT_COMPRESSION_LEVEL;
        private int copyBufferSize = ZipArchiveWriter.DEFAULT_BUFFER_SIZE;
        private int streamBufferSize = DEFAULT_STREAM_BUFFER_SIZE;
        private VersionConflictStrategy conflictStrategy = VersionConflictStrategy.LAST_WINS;
        private Collection<String> excludedDirectories = PathFilter.DEFAULT_EXCLUDED_DIRECTORIES;
        private Collection<String> excludedFiles = PathFilter.DEFAULT_EXCLUDED_FILES;
        private String manifestPath = "backend/package.json";
        private String schemaPath = "backend/prisma/schema.prisma";
        private String webManifestPath = "web/package.json";
        private String envTemplatePath = EnvTemplateGenerator.DEFAULT_PATH;
        private String readmePath = ReadmeGenerator.DEFAULT_PATH;
        private String licensePath = LicenseGenerator.DEFAULT_PATH;
        private String descriptorPath = DescriptorGenerator.DEFAULT_PATH;
        private List<EnvVarSpec> baseEnvVars = EnvMerger.CORE_VARIABLES;
        private Clock clock = Clock.systemUTC();
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;
        private int asyncThreads = DEFAULT_ASYNC_THREADS;

        public Builder fallbackTemplateSlug(String fallbackTemplateSlug) {
            this.fallbackTemplateSlug = requireText(fallbackTemplateSlug, "fallbackTemplateSlug");
            return this;
        }

        public Builder productName(String productName) {
            this.productName = requireText(productName, "productName");
            return this;
        }

        public Builder compressionLevel(int compressionLevel) {
            if (compressionLevel < 0 || compressionLevel > 9) {
                throw new IllegalArgumentException("compressionLevel must be between 0 and 9");
            }
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder copyBufferSize(int copyBufferSize) {
            if (copyBufferSize <= 0) {
                throw new IllegalArgumentException("copyBufferSize must be positive");
            }
            this.copyBufferSize = copyBufferSize;
            return this;
        }

        public Builder streamBufferSize(int streamBufferSize) {
            if (streamBufferSize <= 0) {
                throw new IllegalArgumentException("streamBufferSize must be positive");
            }
            this.streamBufferSize = streamBufferSize;
            return this;
        }

        public Builder conflictStrategy(VersionConflictStrategy conflictStrategy) {
            this.conflictStrategy = Objects.requireNonNull(conflictStrategy, "conflictStrategy is required");
            return this;
        }

        public Builder excludedDirectories(Collection<String> excludedDirectories) {
            this.excludedDirectories = Objects.requireNonNull(excludedDirectories, "excludedDirectories is required");
            return this;
        }

        public Builder excludedFiles(Collection<String> excludedFiles) {
            this.excludedFiles = Objects.requireNonNull(excludedFiles, "excludedFiles is required");
            return this;
        }

        public Builder manifestPath(String manifestPath) {
            this.manifestPath = requireText(manifestPath, "manifestPath");
            return this;
        }

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = requireText(schemaPath, "schemaPath");
            return this;
        }

        public Builder webManifestPath(String webManifestPath) {
            this.webManifestPath = requireText(webManifestPath, "webManifestPath");
            return this;
        }

        /**
         * Copies the template's web app manifest unchanged.
         */
        public Builder withoutWebManifest() {
            this.webManifestPath = null;
            return this;
        }

        public Builder envTemplatePath(String envTemplatePath) {
            this.envTemplatePath = requireText(envTemplatePath, "envTemplatePath");
            return this;
        }

        public Builder readmePath(String readmePath) {
            this.readmePath = requireText(readmePath, "readmePath");
            return this;
        }

        public Builder licensePath(String licensePath) {
            this.licensePath = requireText(licensePath, "licensePath");
            return this;
        }

        public Builder descriptorPath(String descriptorPath) {
            this.descriptorPath = requireText(descriptorPath, "descriptorPath");
            return this;
        }

        public Builder baseEnvVars(List<EnvVarSpec> baseEnvVars) {
            this.baseEnvVars = Objects.requireNonNull(baseEnvVars, "baseEnvVars is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be positive");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public Builder asyncThreads(int asyncThreads) {
            if (asyncThreads <= 0) {
                throw new IllegalArgumentException("asyncThreads must be positive");
            }
            this.asyncThreads = asyncThreads;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
            return value;
        }
    }
}
