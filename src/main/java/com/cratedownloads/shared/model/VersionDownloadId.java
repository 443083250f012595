package com.cratedownloads.shared.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Composite primary key for VersionDownload entity.
 */
public class VersionDownloadId implements Serializable {

    private Long versionId;
    private LocalDate downloadDate;

    public VersionDownloadId() {
    }

    public VersionDownloadId(Long versionId, LocalDate downloadDate) {
        this.versionId = versionId;
        this.downloadDate = downloadDate;
    }

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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionDownloadId that = (VersionDownloadId) o;
        return Objects.equals(versionId, that.versionId) &&
               Objects.equals(downloadDate, that.downloadDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versionId, downloadDate);
    }
}
