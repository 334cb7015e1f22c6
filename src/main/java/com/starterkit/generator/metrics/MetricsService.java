package com.starterkit.generator.metrics;

import java.time.Duration;

/**
 * Interface for recording generation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordGenerationDuration(String tier, Duration duration);

    void incrementGenerationFailed(String tier, String errorType);

    void recordFeaturesResolved(int resolved, int unresolved);

    void recordArchiveEntries(long entries);

    void recordArchiveBytes(long bytes);

    void incrementVersionConflicts(int conflicts);
}
