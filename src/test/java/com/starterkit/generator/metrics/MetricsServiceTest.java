package com.starterkit.generator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordGenerationDuration("pro", Duration.ofMillis(100));
                noOp.incrementGenerationFailed("pro", "BaseTemplateException");
                noOp.recordFeaturesResolved(3, 1);
                noOp.recordArchiveEntries(42);
                noOp.recordArchiveBytes(1024);
                noOp.incrementVersionConflicts(2);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record generation duration per tier")
        void recordGenerationDuration() {
            metrics.recordGenerationDuration("pro", Duration.ofMillis(150));
            metrics.recordGenerationDuration("pro", Duration.ofMillis(250));
            metrics.recordGenerationDuration("starter", Duration.ofMillis(50));

            Timer pro = registry.find("generator.generation.duration").tag("tier", "pro").timer();
            Timer starter = registry.find("generator.generation.duration").tag("tier", "starter").timer();

            assertNotNull(pro);
            assertEquals(2, pro.count());
            assertNotNull(starter);
            assertEquals(1, starter.count());
        }

        @Test
        @DisplayName("Should count failures by tier and error type")
        void incrementGenerationFailed() {
            metrics.incrementGenerationFailed("pro", "ArchiveWriteException");
            metrics.incrementGenerationFailed("pro", "ArchiveWriteException");
            metrics.incrementGenerationFailed("pro", "BaseTemplateException");

            Counter writeFailures = registry.find("generator.generation.failed")
                    .tag("tier", "pro").tag("errorType", "ArchiveWriteException").counter();
            Counter templateFailures = registry.find("generator.generation.failed")
                    .tag("errorType", "BaseTemplateException").counter();

            assertNotNull(writeFailures);
            assertEquals(2.0, writeFailures.count());
            assertNotNull(templateFailures);
            assertEquals(1.0, templateFailures.count());
        }

        @Test
        @DisplayName("Should record resolved feature counts and unresolved slugs")
        void recordFeaturesResolved() {
            metrics.recordFeaturesResolved(4, 0);
            metrics.recordFeaturesResolved(2, 3);

            DistributionSummary resolved = registry.find("generator.features.resolved").summary();
            Counter unresolved = registry.find("generator.features.unresolved").counter();

            assertNotNull(resolved);
            assertEquals(2, resolved.count());
            assertEquals(6.0, resolved.totalAmount());
            assertEquals(3.0, unresolved.count());
        }

        @Test
        @DisplayName("Should record archive entries and bytes")
        void recordArchive() {
            metrics.recordArchiveEntries(30);
            metrics.recordArchiveBytes(2048);

            assertEquals(30.0, registry.find("generator.archive.entries").summary().totalAmount());
            assertEquals(2048.0, registry.find("generator.archive.bytes").summary().totalAmount());
        }

        @Test
        @DisplayName("Should count version conflicts, ignoring zero")
        void incrementVersionConflicts() {
            metrics.incrementVersionConflicts(0);
            metrics.incrementVersionConflicts(2);

            assertEquals(2.0, registry.find("generator.version.conflicts").counter().count());
        }
    }
}
