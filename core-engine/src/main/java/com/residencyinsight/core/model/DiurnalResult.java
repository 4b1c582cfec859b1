package com.residencyinsight.core.model;

import java.util.Objects;

/**
 * Hourly profile with its peak and trough hour.
 *
 * @since 1.0.0
 */
public final class DiurnalResult {

    private final HourlyProfile profile;
    private final int peakHour;
    private final int troughHour;

    public DiurnalResult(HourlyProfile profile, int peakHour, int troughHour) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.peakHour = peakHour;
        this.troughHour = troughHour;
    }

    public HourlyProfile getProfile() {
        return profile;
    }

    public int getPeakHour() {
        return peakHour;
    }

    public int getTroughHour() {
        return troughHour;
    }

    @Override
    public String toString() {
        return "DiurnalResult{peakHour=" + peakHour + ", troughHour=" + troughHour + '}';
    }
}
