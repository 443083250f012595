package com.cratedownloads.downloads;

/**
 * Thrown when a crate name and version number do not resolve to a published version.
 */
public class VersionNotFoundException extends RuntimeException {

    public VersionNotFoundException(String crateName, String versionNum) {
        super(String.format("crate `%s` does not have a version `%s`", crateName, versionNum));
    }
}
