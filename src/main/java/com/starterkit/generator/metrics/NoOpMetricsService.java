package com.starterkit.generator.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * Used as the default when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordGenerationDuration(String tier, Duration duration) {
    }

    @Override
    public void incrementGenerationFailed(String tier, String errorType) {
    }

    @Override
    public void recordFeaturesResolved(int resolved, int unresolved) {
    }

    @Override
    public void recordArchiveEntries(long entries) {
    }

    @Override
    public void recordArchiveBytes(long bytes) {
    }

    @Override
    public void incrementVersionConflicts(int conflicts) {
    }
}
