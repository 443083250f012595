package com.cratedownloads.downloads.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inclusive trailing range of calendar days ending at a given date.
 */
public final class DownloadWindow {
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final int days;

    private DownloadWindow(LocalDate startDate, LocalDate endDate, int days) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.days = days;
    }

    /**
     * Window of {@code days} days whose last day is {@code endDate}.
     */
    public static DownloadWindow endingAt(LocalDate endDate, int days) {
        Objects.requireNonNull(endDate, "endDate");
        if (days < 1) {
            throw new IllegalArgumentException("window must cover at least one day: " + days);
        }
        return new DownloadWindow(endDate.minusDays(days - 1L), endDate, days);
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public int getDays() {
        return days;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    /**
     * Expands sparse counts into one entry per day of the window, oldest first.
     * Days without a count get zero; counts outside the window are ignored.
     */
    public List<DailyDownloadCount> fillGaps(Collection<DailyDownloadCount> counts) {
        Map<LocalDate, Integer> byDate = new HashMap<>();
        for (DailyDownloadCount count : counts) {
            if (contains(count.getDate())) {
                byDate.merge(count.getDate(), count.getDownloads(), Integer::sum);
            }
        }

        List<DailyDownloadCount> series = new ArrayList<>(days);
        for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
            series.add(new DailyDownloadCount(day, byDate.getOrDefault(day, 0)));
        }
        return series;
    }
}
