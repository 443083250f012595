package com.cratedownloads.downloads.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Download count of one version on one day, as served by a history read.
 */
public class DailyDownloadCount {
    private final LocalDate date;
    private final int downloads;

    public DailyDownloadCount(LocalDate date, int downloads) {
        if (downloads < 0) {
            throw new IllegalArgumentException("downloads must not be negative: " + downloads);
        }
        this.date = Objects.requireNonNull(date, "date");
        this.downloads = downloads;
    }

    public LocalDate getDate() {
        return date;
    }

    public int getDownloads() {
        return downloads;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DailyDownloadCount that = (DailyDownloadCount) o;
        return downloads == that.downloads && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, downloads);
    }

    @Override
    public String toString() {
        return date + "=" + downloads;
    }
}
