package com.starterkit.generator.api;

import com.starterkit.generator.merge.EnvMerger;
import com.starterkit.generator.merge.VersionConflictStrategy;
import com.starterkit.generator.template.PathFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GenerationOptions Tests")
class GenerationOptionsTest {

    @Test
    @DisplayName("Defaults match the standard repository layout")
    void defaults() {
        GenerationOptions options = GenerationOptions.defaults();

        assertEquals("starter", options.getFallbackTemplateSlug());
        assertEquals("Starter Kit", options.getProductName());
        assertEquals(9, options.getCompressionLevel());
        assertEquals(VersionConflictStrategy.LAST_WINS, options.getConflictStrategy());
        assertEquals("backend/package.json", options.getManifestPath());
        assertEquals("backend/prisma/schema.prisma", options.getSchemaPath());
        assertEquals("web/package.json", options.getWebManifestPath().orElseThrow());
        assertEquals("backend/.env.example", options.getEnvTemplatePath());
        assertEquals("starter-config.json", options.getDescriptorPath());
        assertEquals(EnvMerger.CORE_VARIABLES, options.getBaseEnvVars());
        assertEquals(PathFilter.DEFAULT_EXCLUDED_DIRECTORIES, options.getExcludedDirectories());
        assertTrue(options.pathFilter().isExcludedFile(".env"));
    }

    @Test
    @DisplayName("Builder overrides are applied")
    void overrides() {
        GenerationOptions options = GenerationOptions.builder()
                .fallbackTemplateSlug("custom")
                .productName("Acme Kit")
                .compressionLevel(1)
                .conflictStrategy(VersionConflictStrategy.HIGHEST_VERSION)
                .excludedDirectories(List.of("tmp"))
                .excludedFiles(List.of())
                .asyncThreads(2)
                .build();

        assertEquals("custom", options.getFallbackTemplateSlug());
        assertEquals("Acme Kit", options.getProductName());
        assertEquals(1, options.getCompressionLevel());
        assertEquals(VersionConflictStrategy.HIGHEST_VERSION, options.getConflictStrategy());
        assertTrue(options.pathFilter().isExcludedDirectory("tmp"));
        assertFalse(options.pathFilter().isExcludedFile(".env"));
        assertEquals(2, options.getAsyncThreads());
    }

    @Test
    @DisplayName("The web manifest can be moved or turned off")
    void webManifestPath() {
        assertEquals("apps/web/package.json",
                GenerationOptions.builder().webManifestPath("apps/web/package.json").build()
                        .getWebManifestPath().orElseThrow());
        assertTrue(GenerationOptions.builder().withoutWebManifest().build().getWebManifestPath().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().webManifestPath(" "));
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().compressionLevel(10));
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().compressionLevel(-1));
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().streamBufferSize(0));
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().asyncTimeoutMs(0));
        assertThrows(IllegalArgumentException.class, () -> GenerationOptions.builder().productName(" "));
        assertThrows(NullPointerException.class, () -> GenerationOptions.builder().conflictStrategy(null));
    }
}
