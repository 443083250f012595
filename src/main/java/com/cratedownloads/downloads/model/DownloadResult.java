package com.cratedownloads.downloads.model;

/**
 * Outcome of serving a download: where the artifact lives and whether the download was counted.
 */
public class DownloadResult {
    private final String crateName;
    private final String url;
    private final boolean counted;

    public DownloadResult(String crateName, String url, boolean counted) {
        this.crateName = crateName;
        this.url = url;
        this.counted = counted;
    }

    public String getCrateName() {
        return crateName;
    }

    public String getUrl() {
        return url;
    }

    public boolean isCounted() {
        return counted;
    }
}
