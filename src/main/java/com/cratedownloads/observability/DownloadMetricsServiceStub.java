package com.cratedownloads.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Stub implementation when metrics are disabled.
 * Phases still run; only the timing is dropped.
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "false")
public class DownloadMetricsServiceStub implements DownloadMetricsServiceInterface {

    @Override
    public <T> T recordPhase(String phase, Supplier<T> action) {
        return action.get();
    }

    @Override
    public void recordDownloadOutcome(String outcome) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordUncountedDownload(String crateName) {
        // No-op when metrics are disabled
    }
}
