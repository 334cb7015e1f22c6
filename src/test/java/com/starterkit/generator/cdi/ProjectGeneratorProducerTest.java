package com.starterkit.generator.cdi;

import com.starterkit.generator.TestFixtures;
import com.starterkit.generator.api.GenerationOptions;
import com.starterkit.generator.api.ProjectGenerator;
import com.starterkit.generator.catalog.CachingFeatureCatalog;
import com.starterkit.generator.merge.VersionConflictStrategy;
import com.starterkit.generator.metrics.MetricsService;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProjectGeneratorProducer Tests")
class ProjectGeneratorProducerTest {

    @TempDir
    Path repo;

    private ProjectGeneratorProducer producer;

    @Mock
    private Instance<MetricsService> metricsServices;

    @Mock
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        TestFixtures.writeRepository(repo);

        producer = new ProjectGeneratorProducer();
        producer.repositoryRoot = repo.toString();
        producer.templateRoot = Optional.empty();
        producer.fallbackTemplateSlug = "starter";
        producer.productName = "Starter Kit";
        producer.excludedDirectories = Optional.empty();
        producer.excludedFiles = Optional.empty();
        producer.webManifestPath = Optional.empty();
        producer.webManifestEnabled = true;
        producer.compressionLevel = 6;
        producer.conflictStrategy = "highest_version";
        producer.streamBufferSize = 65536;
        producer.asyncThreads = 2;
        producer.asyncTimeoutMs = 30_000;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.tracingEnabled = false;
        producer.metricsServices = metricsServices;
    }

    @Test
    @DisplayName("Should build options from configuration")
    void options() {
        producer.excludedFiles = Optional.of(List.of("*.bak"));

        GenerationOptions options = producer.generationOptions();

        assertEquals(6, options.getCompressionLevel());
        assertEquals(VersionConflictStrategy.HIGHEST_VERSION, options.getConflictStrategy());
        assertTrue(options.pathFilter().isExcludedFile("old.bak"));
        assertFalse(options.pathFilter().isExcludedFile(".env"));
        assertEquals(2, options.getAsyncThreads());
        assertEquals("web/package.json", options.getWebManifestPath().orElseThrow());
    }

    @Test
    @DisplayName("Should move or disable the web manifest from configuration")
    void webManifest() {
        producer.webManifestPath = Optional.of("apps/web/package.json");
        assertEquals("apps/web/package.json", producer.generationOptions().getWebManifestPath().orElseThrow());

        producer.webManifestEnabled = false;
        assertTrue(producer.generationOptions().getWebManifestPath().isEmpty());
    }

    @Test
    @DisplayName("Should produce a cached generator without metrics by default")
    void generator() {
        when(metricsServices.isResolvable()).thenReturn(false);

        ProjectGenerator generator = producer.projectGenerator(TestFixtures.sampleCatalog(), producer.generationOptions());
        try {
            assertInstanceOf(CachingFeatureCatalog.class, generator.getCatalog());
            assertEquals(repo.toAbsolutePath().normalize().resolve("core/base-template"), generator.getTemplate().getRoot());
            verify(metricsServices, never()).get();
        } finally {
            producer.closeGenerator(generator);
        }
    }

    @Test
    @DisplayName("Should use the configured template root and metrics bean")
    void customTemplateRoot() {
        when(metricsServices.isResolvable()).thenReturn(true);
        when(metricsServices.get()).thenReturn(metrics);
        producer.templateRoot = Optional.of("templates/base");
        producer.cacheEnabled = false;

        ProjectGenerator generator = producer.projectGenerator(TestFixtures.sampleCatalog(), producer.generationOptions());
        try {
            assertEquals(repo.toAbsolutePath().normalize().resolve("templates/base"), generator.getTemplate().getRoot());
            assertFalse(generator.getCatalog() instanceof CachingFeatureCatalog);
            verify(metricsServices).get();
        } finally {
            producer.closeGenerator(generator);
        }
    }
}
