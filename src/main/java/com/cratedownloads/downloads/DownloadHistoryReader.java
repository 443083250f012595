package com.cratedownloads.downloads;

import com.cratedownloads.downloads.model.DailyDownloadCount;
import com.cratedownloads.downloads.model.DownloadWindow;
import com.cratedownloads.shared.model.VersionDownload;
import com.cratedownloads.shared.repository.VersionDownloadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Reads the trailing download history of a version.
 * Unlike recording, failures here propagate: the history is what the caller asked for.
 */
@Service
public class DownloadHistoryReader {

    private static final Logger logger = LoggerFactory.getLogger(DownloadHistoryReader.class);

    private final VersionDownloadRepository versionDownloadRepository;
    private final Clock clock;
    private final int windowDays;

    public DownloadHistoryReader(
            VersionDownloadRepository versionDownloadRepository,
            Clock clock,
            @Value("${app.downloads.history-window-days:90}") int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("app.downloads.history-window-days must be at least 1");
        }
        this.versionDownloadRepository = versionDownloadRepository;
        this.clock = clock;
        this.windowDays = windowDays;
    }

    /**
     * Fetches the daily counts of a version for the window ending at {@code endDate}.
     *
     * @param versionId resolved version ID
     * @param endDate last day of the window, or null for today in the reference calendar
     * @param fillGaps when true, return exactly one entry per day of the window with zero for
     *                 days that have no counter; when false, return only the persisted counters
     * @return counts ordered by date ascending
     */
    @Transactional(readOnly = true, timeoutString = "${app.downloads.history-timeout-seconds:10}")
    public List<DailyDownloadCount> fetchHistory(Long versionId, LocalDate endDate, boolean fillGaps) {
        Objects.requireNonNull(versionId, "versionId");
        DownloadWindow window = windowEndingAt(endDate != null ? endDate : LocalDate.now(clock));

        List<DailyDownloadCount> persisted = versionDownloadRepository
                .findInRange(versionId, window.getStartDate(), window.getEndDate())
                .stream()
                .map(DownloadHistoryReader::toDailyCount)
                .toList();

        logger.debug("Loaded {} download counter(s) for version {} between {} and {}",
                persisted.size(), versionId, window.getStartDate(), window.getEndDate());

        return fillGaps ? window.fillGaps(persisted) : persisted;
    }

    /**
     * Window of the configured length ending at the given day.
     */
    public DownloadWindow windowEndingAt(LocalDate endDate) {
        return DownloadWindow.endingAt(endDate, windowDays);
    }

    public int getWindowDays() {
        return windowDays;
    }

    private static DailyDownloadCount toDailyCount(VersionDownload download) {
        return new DailyDownloadCount(download.getDownloadDate(), download.getDownloads());
    }
}
