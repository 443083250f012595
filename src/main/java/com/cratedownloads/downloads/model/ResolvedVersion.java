package com.cratedownloads.downloads.model;

/**
 * A crate version resolved to its internal ID.
 * The crate name is the stored spelling, which may differ from the requested one.
 */
public class ResolvedVersion {
    private final Long versionId;
    private final String crateName;
    private final String num;

    public ResolvedVersion(Long versionId, String crateName, String num) {
        this.versionId = versionId;
        this.crateName = crateName;
        this.num = num;
    }

    public Long getVersionId() {
        return versionId;
    }

    public String getCrateName() {
        return crateName;
    }

    public String getNum() {
        return num;
    }
}
