package com.cratedownloads.shared.dto;

import java.time.LocalDate;

/**
 * DTO for one day of a version's download history.
 */
public class VersionDownloadResponse {

    private Long version;
    private LocalDate date;
    private int downloads;

    public VersionDownloadResponse() {
    }

    public VersionDownloadResponse(Long version, LocalDate date, int downloads) {
        this.version = version;
        this.date = date;
        this.downloads = downloads;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public int getDownloads() {
        return downloads;
    }

    public void setDownloads(int downloads) {
        this.downloads = downloads;
    }
}
