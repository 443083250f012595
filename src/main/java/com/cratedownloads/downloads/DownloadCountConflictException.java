package com.cratedownloads.downloads;

import org.springframework.dao.ConcurrencyFailureException;

import java.time.LocalDate;

/**
 * Thrown when the upsert-increment sequence keeps losing races for the same version and day
 * until its attempt bound is exhausted.
 */
public class DownloadCountConflictException extends ConcurrencyFailureException {

    public DownloadCountConflictException(Long versionId, LocalDate downloadDate, int attempts) {
        super(String.format("Could not create or increment download counter for version %d on %s after %d attempt(s)",
                versionId, downloadDate, attempts));
    }
}
