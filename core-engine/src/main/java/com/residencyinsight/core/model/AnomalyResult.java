package com.residencyinsight.core.model;

import java.util.Objects;

/**
 * Output of a point-anomaly detector: the flags plus their count and rate.
 *
 * @since 1.0.0
 */
public final class AnomalyResult {

    private final String detectorName;
    private final AnomalyFlagSet flags;

    public AnomalyResult(String detectorName, AnomalyFlagSet flags) {
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName must not be null");
        this.flags = Objects.requireNonNull(flags, "flags must not be null");
    }

    public String getDetectorName() {
        return detectorName;
    }

    public AnomalyFlagSet getFlags() {
        return flags;
    }

    public int getCount() {
        return flags.count();
    }

    public double getRate() {
        return flags.rate();
    }

    @Override
    public String toString() {
        return "AnomalyResult{" +
                "detector='" + detectorName + '\'' +
                ", count=" + getCount() +
                ", rate=" + getRate() +
                '}';
    }
}
