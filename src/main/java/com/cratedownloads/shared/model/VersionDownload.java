package com.cratedownloads.shared.model;

import jakarta.persistence.*;

import java.time.LocalDate;

/**
 * Entity representing the download counter of one crate version on one calendar day.
 * Rows are created lazily by the first recorded download of the day and only ever incremented.
 */
@Entity
@Table(name = "version_downloads", indexes = {
    @Index(name = "idx_version_downloads_date", columnList = "date")
})
@IdClass(VersionDownloadId.class)
public class VersionDownload {

    @Id
    @Column(name = "version_id", nullable = false, updatable = false)
    private Long versionId;

    @Id
    @Column(name = "date", nullable = false, updatable = false)
    private LocalDate downloadDate;

    @Column(name = "downloads", nullable = false)
    private Integer downloads = 1;

    // Constructors
    public VersionDownload() {
    }

    public VersionDownload(Long versionId, LocalDate downloadDate, Integer downloads) {
        this.versionId = versionId;
        this.downloadDate = downloadDate;
        this.downloads = downloads;
    }

    // Getters and Setters
    public Long getVersionId() {
        return versionId;
    }

    public void setVersionId(Long versionId) {
        this.versionId = versionId;
    }

    public LocalDate getDownloadDate() {
        return downloadDate;
    }

    public void setDownloadDate(LocalDate downloadDate) {
        this.downloadDate = downloadDate;
    }

    public Integer getDownloads() {
        return downloads;
    }

    public void setDownloads(Integer downloads) {
        this.downloads = downloads;
    }
}
