package com.cratedownloads.api.storage;

/**
 * Interface for locating stored crate artifacts.
 * Implementations map a crate version to the URL clients download it from.
 */
public interface CrateLocationService {

    /**
     * Returns the download URL of a crate version's artifact.
     *
     * @param crateName crate name as stored
     * @param version   version number
     * @return absolute URL of the .crate file
     */
    String crateLocation(String crateName, String version);
}
