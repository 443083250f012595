package com.cratedownloads.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Service for emitting download metrics through Micrometer.
 * Only active when app.metrics.enabled=true.
 *
 * Metrics:
 * - crates.download.phase: Timer per named phase (get_version, update_count)
 * - crates.download.recorded: Counter of record attempts tagged by outcome
 * - crates.download.uncounted: Counter of downloads served without being counted
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class DownloadMetricsService implements DownloadMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(DownloadMetricsService.class);

    private final MeterRegistry meterRegistry;

    public DownloadMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public <T> T recordPhase(String phase, Supplier<T> action) {
        Timer timer = Timer.builder("crates.download.phase")
                .description("Duration of a named download handling phase")
                .tag("phase", phase != null ? phase : "unknown")
                .register(meterRegistry);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return action.get();
        } finally {
            long nanos = sample.stop(timer);
            logger.trace("Recorded phase {} in {}ns", phase, nanos);
        }
    }

    @Override
    public void recordDownloadOutcome(String outcome) {
        Counter.builder("crates.download.recorded")
                .description("Download record attempts by outcome")
                .tag("outcome", outcome != null ? outcome : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordUncountedDownload(String crateName) {
        Counter.builder("crates.download.uncounted")
                .description("Downloads served without updating the counter")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded uncounted download for crate={}", crateName);
    }
}
