package com.cratedownloads.downloads;

import com.cratedownloads.observability.DownloadMetricsServiceInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Best-effort recording of download counts.
 *
 * Store failures are expected when the service runs read-only, or against an API-only
 * mirror, and can happen for any other reason. A download that cannot be counted must
 * still be served, so every store failure is logged and reported as {@code false}
 * instead of being thrown.
 */
@Service
public class DownloadCountRecorder {

    private static final Logger logger = LoggerFactory.getLogger(DownloadCountRecorder.class);

    static final String OUTCOME_COUNTED = "counted";
    static final String OUTCOME_READ_ONLY = "read_only";
    static final String OUTCOME_CONFLICT = "conflict";
    static final String OUTCOME_STORE_FAILURE = "store_failure";

    private final VersionDownloadWriter versionDownloadWriter;
    private final DownloadMetricsServiceInterface metricsService;
    private final boolean readOnly;

    public DownloadCountRecorder(
            VersionDownloadWriter versionDownloadWriter,
            DownloadMetricsServiceInterface metricsService,
            @Value("${app.downloads.read-only:false}") boolean readOnly) {
        this.versionDownloadWriter = versionDownloadWriter;
        this.metricsService = metricsService;
        this.readOnly = readOnly;
    }

    /**
     * Adds one download to the counter of a version on a day.
     *
     * @param versionId resolved version ID (existence is checked by the caller)
     * @param downloadDate the current day in the reference calendar
     * @return true if the counter was durably updated, false if the download was not counted
     * @throws NullPointerException if versionId or downloadDate is null
     */
    public boolean recordDownload(Long versionId, LocalDate downloadDate) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(downloadDate, "downloadDate");

        if (readOnly) {
            logger.debug("Read-only mode, not counting download: versionId={}, date={}", versionId, downloadDate);
            metricsService.recordDownloadOutcome(OUTCOME_READ_ONLY);
            return false;
        }

        String outcome;
        try {
            int attempt = metricsService.recordPhase(DownloadMetricsServiceInterface.PHASE_UPDATE_COUNT,
                    () -> versionDownloadWriter.createOrIncrement(versionId, downloadDate));
            if (attempt > 1) {
                logger.debug("Counted download for version {} on {} after {} attempts", versionId, downloadDate, attempt);
            }
            outcome = OUTCOME_COUNTED;
        } catch (DownloadCountConflictException e) {
            logger.warn("Download not counted: versionId={}, date={}: {}", versionId, downloadDate, e.getMessage());
            outcome = OUTCOME_CONFLICT;
        } catch (DataAccessException | TransactionException e) {
            logger.warn("Download not counted: versionId={}, date={}, error={}: {}",
                    versionId, downloadDate, e.getClass().getSimpleName(), e.getMessage());
            outcome = OUTCOME_STORE_FAILURE;
        } catch (RuntimeException e) {
            // Untranslated persistence errors, e.g. a commit failure surfaced as PersistenceException
            logger.warn("Download not counted: versionId={}, date={}, unexpected error={}: {}",
                    versionId, downloadDate, e.getClass().getName(), e.getMessage());
            outcome = OUTCOME_STORE_FAILURE;
        }

        metricsService.recordDownloadOutcome(outcome);
        return OUTCOME_COUNTED.equals(outcome);
    }
}
