package com.cratedownloads.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for the download history endpoint.
 */
public class VersionDownloadsResponse {

    @JsonProperty("version_downloads")
    private List<VersionDownloadResponse> versionDownloads;

    public VersionDownloadsResponse() {
    }

    public VersionDownloadsResponse(List<VersionDownloadResponse> versionDownloads) {
        this.versionDownloads = versionDownloads;
    }

    public List<VersionDownloadResponse> getVersionDownloads() {
        return versionDownloads;
    }

    public void setVersionDownloads(List<VersionDownloadResponse> versionDownloads) {
        this.versionDownloads = versionDownloads;
    }
}
