package com.cratedownloads.shared.dto;

/**
 * DTO returned instead of a redirect when the client asks for JSON.
 */
public class DownloadUrlResponse {

    private String url;

    public DownloadUrlResponse() {
    }

    public DownloadUrlResponse(String url) {
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
