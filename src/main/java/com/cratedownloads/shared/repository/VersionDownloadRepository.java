package com.cratedownloads.shared.repository;

import com.cratedownloads.shared.model.VersionDownload;
import com.cratedownloads.shared.model.VersionDownloadId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for daily version download counters.
 * The increment and insert-if-absent statements together form the upsert-increment sequence.
 */
@Repository
public interface VersionDownloadRepository extends JpaRepository<VersionDownload, VersionDownloadId> {

    /**
     * Find the counter of a version on a specific day.
     */
    Optional<VersionDownload> findByVersionIdAndDownloadDate(Long versionId, LocalDate downloadDate);

    /**
     * Find all counters of a version within an inclusive date range, oldest first.
     * @param versionId the version ID
     * @param startDate first day of the range (inclusive)
     * @param endDate last day of the range (inclusive)
     * @return persisted counters ordered by date ascending
     */
    @Query("""
        SELECT d FROM VersionDownload d
        WHERE d.versionId = :versionId
        AND d.downloadDate BETWEEN :startDate AND :endDate
        ORDER BY d.downloadDate ASC
        """)
    List<VersionDownload> findInRange(
            @Param("versionId") Long versionId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * Increment an existing counter by one.
     * @return number of updated rows (0 when the day has no counter yet)
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE VersionDownload d
        SET d.downloads = d.downloads + 1
        WHERE d.versionId = :versionId
        AND d.downloadDate = :downloadDate
        """)
    int incrementDownloads(
            @Param("versionId") Long versionId,
            @Param("downloadDate") LocalDate downloadDate
    );

    /**
     * Create the counter with a count of one unless a row for the same version and day exists.
     * Uses PostgreSQL's ON CONFLICT DO NOTHING so a lost race does not abort the transaction.
     * @return number of inserted rows (0 when another writer created the row first)
     */
    @Modifying
    @Query(value = """
        INSERT INTO version_downloads (version_id, date, downloads)
        VALUES (:versionId, :downloadDate, 1)
        ON CONFLICT (version_id, date) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(
            @Param("versionId") Long versionId,
            @Param("downloadDate") LocalDate downloadDate
    );
}
