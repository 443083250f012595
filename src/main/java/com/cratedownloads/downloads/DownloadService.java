package com.cratedownloads.downloads;

import com.cratedownloads.api.storage.CrateLocationService;
import com.cratedownloads.downloads.model.DownloadResult;
import com.cratedownloads.downloads.model.ResolvedVersion;
import com.cratedownloads.observability.DownloadMetricsServiceInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Serves crate downloads: resolves the version, counts the download and returns the artifact URL.
 * Resolution failures propagate; counting failures only mark the download as uncounted.
 */
@Service
public class DownloadService {

    private static final Logger logger = LoggerFactory.getLogger(DownloadService.class);

    static final String UNCOUNTED_MDC_KEY = "uncounted_dl";

    private final VersionResolver versionResolver;
    private final DownloadCountRecorder downloadCountRecorder;
    private final CrateLocationService crateLocationService;
    private final DownloadMetricsServiceInterface metricsService;
    private final Clock clock;

    public DownloadService(
            VersionResolver versionResolver,
            DownloadCountRecorder downloadCountRecorder,
            CrateLocationService crateLocationService,
            DownloadMetricsServiceInterface metricsService,
            Clock clock) {
        this.versionResolver = versionResolver;
        this.downloadCountRecorder = downloadCountRecorder;
        this.crateLocationService = crateLocationService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * @throws VersionNotFoundException if the crate version does not exist
     */
    public DownloadResult download(String crateName, String versionNum) {
        ResolvedVersion version = metricsService.recordPhase(DownloadMetricsServiceInterface.PHASE_GET_VERSION,
                () -> versionResolver.resolve(crateName, versionNum));

        boolean counted = downloadCountRecorder.recordDownload(version.getVersionId(), LocalDate.now(clock));

        String url = crateLocationService.crateLocation(version.getCrateName(), version.getNum());

        if (!counted) {
            metricsService.recordUncountedDownload(version.getCrateName());
            try (MDC.MDCCloseable ignored = MDC.putCloseable(UNCOUNTED_MDC_KEY, "true")) {
                logger.info("Serving uncounted download: crate={}, version={}",
                        version.getCrateName(), version.getNum());
            }
        }

        return new DownloadResult(version.getCrateName(), url, counted);
    }
}
