package com.cratedownloads.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Locates crate artifacts under a static file host using the layout
 * {base-url}/crates/{name}/{name}-{version}.crate.
 */
@Service
public class StaticCrateLocationService implements CrateLocationService {

    private static final Logger logger = LoggerFactory.getLogger(StaticCrateLocationService.class);

    private final String baseUrl;

    public StaticCrateLocationService(@Value("${app.crate-location.base-url:https://static.crates.io}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        logger.info("Crate artifacts served from {}", this.baseUrl);
    }

    @Override
    public String crateLocation(String crateName, String version) {
        return String.format("%s/crates/%s/%s-%s.crate", baseUrl, crateName, crateName, version);
    }
}
