package com.cratedownloads.observability;

import java.util.function.Supplier;

/**
 * Interface for download metrics to support both enabled and disabled modes.
 */
public interface DownloadMetricsServiceInterface {

    String PHASE_GET_VERSION = "get_version";
    String PHASE_UPDATE_COUNT = "update_count";

    /**
     * Runs the action and records its duration under the given phase name,
     * whether it completes normally or throws.
     */
    <T> T recordPhase(String phase, Supplier<T> action);

    void recordDownloadOutcome(String outcome);

    void recordUncountedDownload(String crateName);
}
