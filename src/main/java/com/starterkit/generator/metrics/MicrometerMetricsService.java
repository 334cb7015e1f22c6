package com.starterkit.generator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code generator.generation.duration}: Timer (tag: tier)</li>
 *   <li>{@code generator.generation.failed}: Counter (tags: tier, errorType)</li>
 *   <li>{@code generator.features.resolved}: DistributionSummary</li>
 *   <li>{@code generator.features.unresolved}: Counter</li>
 *   <li>{@code generator.archive.entries}: DistributionSummary</li>
 *   <li>{@code generator.archive.bytes}: DistributionSummary</li>
 *   <li>{@code generator.version.conflicts}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary featuresResolvedSummary;
    private final Counter featuresUnresolvedCounter;
    private final DistributionSummary archiveEntriesSummary;
    private final DistributionSummary archiveBytesSummary;
    private final Counter versionConflictCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.featuresResolvedSummary = DistributionSummary.builder("generator.features.resolved")
                .description("Number of features in each resolved feature set")
                .register(registry);
        this.featuresUnresolvedCounter = Counter.builder("generator.features.unresolved")
                .description("Requested or required slugs missing from the catalog")
                .register(registry);
        this.archiveEntriesSummary = DistributionSummary.builder("generator.archive.entries")
                .description("Number of entries written per archive")
                .register(registry);
        this.archiveBytesSummary = DistributionSummary.builder("generator.archive.bytes")
                .description("Compressed bytes written per archive")
                .baseUnit("bytes")
                .register(registry);
        this.versionConflictCounter = Counter.builder("generator.version.conflicts")
                .description("Package version conflicts resolved during manifest merge")
                .register(registry);
    }

    @Override
    public void recordGenerationDuration(String tier, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(tier, k ->
                Timer.builder("generator.generation.duration")
                        .description("Duration of project generations")
                        .tag("tier", tier)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementGenerationFailed(String tier, String errorType) {
        String key = tier + ":" + errorType;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("generator.generation.failed")
                        .description("Number of failed project generations")
                        .tag("tier", tier)
                        .tag("errorType", errorType)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFeaturesResolved(int resolved, int unresolved) {
        featuresResolvedSummary.record(resolved);
        if (unresolved > 0) {
            featuresUnresolvedCounter.increment(unresolved);
        }
    }

    @Override
    public void recordArchiveEntries(long entries) {
        archiveEntriesSummary.record(entries);
    }

    @Override
    public void recordArchiveBytes(long bytes) {
        archiveBytesSummary.record(bytes);
    }

    @Override
    public void incrementVersionConflicts(int conflicts) {
        if (conflicts > 0) {
            versionConflictCounter.increment(conflicts);
        }
    }
}
