package com.cratedownloads.downloads;

import com.cratedownloads.shared.repository.VersionDownloadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Creates or increments a daily download counter inside its own transaction.
 * The transaction is always new (REQUIRES_NEW) so neither a failure here nor a rollback
 * of the caller's transaction affects the other.
 */
@Service
public class VersionDownloadWriter {

    private static final Logger logger = LoggerFactory.getLogger(VersionDownloadWriter.class);

    private final VersionDownloadRepository versionDownloadRepository;
    private final int maxAttempts;

    public VersionDownloadWriter(
            VersionDownloadRepository versionDownloadRepository,
            @Value("${app.downloads.max-upsert-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.downloads.max-upsert-attempts must be at least 1");
        }
        this.versionDownloadRepository = versionDownloadRepository;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Adds one download to the counter of the given version and day.
     * Tries an increment first; when no row exists, inserts one with a count of one.
     * If another writer inserted the row in between, the increment is retried.
     *
     * @param versionId resolved version ID
     * @param downloadDate day to count the download on
     * @return the attempt (1-based) on which the counter was written
     * @throws DownloadCountConflictException if every attempt lost a race
     * @throws org.springframework.dao.DataAccessException on any store failure
     * @throws org.springframework.transaction.TransactionException if the transaction cannot be started or committed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW,
                   timeoutString = "${app.downloads.record-timeout-seconds:5}")
    public int createOrIncrement(Long versionId, LocalDate downloadDate) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(downloadDate, "downloadDate");

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (versionDownloadRepository.incrementDownloads(versionId, downloadDate) > 0) {
                return attempt;
            }
            if (versionDownloadRepository.insertIfAbsent(versionId, downloadDate) > 0) {
                return attempt;
            }
            logger.debug("Lost insert race for version {} on {} (attempt {}/{})",
                    versionId, downloadDate, attempt, maxAttempts);
        }
        throw new DownloadCountConflictException(versionId, downloadDate, maxAttempts);
    }
}
