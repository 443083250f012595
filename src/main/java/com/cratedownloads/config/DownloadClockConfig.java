package com.cratedownloads.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Reference calendar for "today" on both the recording and the history paths.
 */
@Configuration
public class DownloadClockConfig {

    private static final Logger logger = LoggerFactory.getLogger(DownloadClockConfig.class);

    @Bean
    public Clock downloadClock(@Value("${app.downloads.zone-id:UTC}") String zoneId) {
        Clock clock = Clock.system(ZoneId.of(zoneId));
        logger.info("Download days are counted in zone {}", clock.getZone());
        return clock;
    }
}
