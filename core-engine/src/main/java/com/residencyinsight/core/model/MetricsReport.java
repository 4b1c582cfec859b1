package com.residencyinsight.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Summary of one analytics run over a single system's series.
 *
 * <p>
 * Every analyzer result is optional: an analyzer that failed leaves its field
 * empty and records a message under its name in {@link #getFailures()}, while
 * the results of the other analyzers are still reported.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code label} and {@code series} are required;
 * omitting either throws a {@link NullPointerException} at build time.
 * Instances are read-only once built.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsReport {

    private final String label;
    private final TimeSeries series;
    private final double meanValue;
    private final double[] rollingMean;
    private final AnomalyResult zScoreAnomalies;
    private final AnomalyResult isolationAnomalies;
    private final Integer overlapCount;
    private final PeriodicityResult periodicity;
    private final DiurnalResult diurnal;
    private final TrendReversalResult trendReversals;
    private final Map<String, String> failures;

    private MetricsReport(Builder builder) {
        this.label = Objects.requireNonNull(builder.label, "label must not be null");
        this.series = Objects.requireNonNull(builder.series, "series must not be null");
        this.meanValue = builder.meanValue;
        this.rollingMean = builder.rollingMean != null ? builder.rollingMean.clone() : new double[0];
        this.zScoreAnomalies = builder.zScoreAnomalies;
        this.isolationAnomalies = builder.isolationAnomalies;
        this.overlapCount = builder.overlapCount;
        this.periodicity = builder.periodicity;
        this.diurnal = builder.diurnal;
        this.trendReversals = builder.trendReversals;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.failures));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricsReport}.
     */
    public static class Builder {
        private String label;
        private TimeSeries series;
        private double meanValue = Double.NaN;
        private double[] rollingMean;
        private AnomalyResult zScoreAnomalies;
        private AnomalyResult isolationAnomalies;
        private Integer overlapCount;
        private PeriodicityResult periodicity;
        private DiurnalResult diurnal;
        private TrendReversalResult trendReversals;
        private final Map<String, String> failures = new LinkedHashMap<>();

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder series(TimeSeries series) {
            this.series = series;
            return this;
        }

        public Builder meanValue(double meanValue) {
            this.meanValue = meanValue;
            return this;
        }

        public Builder rollingMean(double[] rollingMean) {
            this.rollingMean = rollingMean;
            return this;
        }

        public Builder zScoreAnomalies(AnomalyResult result) {
            this.zScoreAnomalies = result;
            return this;
        }

        public Builder isolationAnomalies(AnomalyResult result) {
            this.isolationAnomalies = result;
            return this;
        }

        public Builder overlapCount(Integer overlapCount) {
            this.overlapCount = overlapCount;
            return this;
        }

        public Builder periodicity(PeriodicityResult periodicity) {
            this.periodicity = periodicity;
            return this;
        }

        public Builder diurnal(DiurnalResult diurnal) {
            this.diurnal = diurnal;
            return this;
        }

        public Builder trendReversals(TrendReversalResult trendReversals) {
            this.trendReversals = trendReversals;
            return this;
        }

        /**
         * Record that an analyzer failed.
         *
         * @param analyzerName name of the failed analyzer
         * @param message      failure description
         * @return this builder
         */
        public Builder failure(String analyzerName, String message) {
            this.failures.put(Objects.requireNonNull(analyzerName, "analyzerName must not be null"),
                    message != null ? message : "unknown error");
            return this;
        }

        /**
         * @return a new {@link MetricsReport}
         * @throws NullPointerException if {@code label} or {@code series} is
         *                              {@code null}
         */
        public MetricsReport build() {
            return new MetricsReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getLabel() {
        return label;
    }

    public TimeSeries getSeries() {
        return series;
    }

    /**
     * @return mean of the analysed series, {@code NaN} for an empty series
     */
    public double getMeanValue() {
        return meanValue;
    }

    public double[] getRollingMean() {
        return rollingMean.clone();
    }

    public Optional<AnomalyResult> getZScoreAnomalies() {
        return Optional.ofNullable(zScoreAnomalies);
    }

    public Optional<AnomalyResult> getIsolationAnomalies() {
        return Optional.ofNullable(isolationAnomalies);
    }

    /**
     * @return number of samples flagged by both detectors, empty unless both
     *         succeeded
     */
    public OptionalInt getOverlapCount() {
        return overlapCount == null ? OptionalInt.empty() : OptionalInt.of(overlapCount);
    }

    public Optional<PeriodicityResult> getPeriodicity() {
        return Optional.ofNullable(periodicity);
    }

    public Optional<DiurnalResult> getDiurnal() {
        return Optional.ofNullable(diurnal);
    }

    public Optional<TrendReversalResult> getTrendReversals() {
        return Optional.ofNullable(trendReversals);
    }

    /**
     * @return unmodifiable map of analyzer name to failure message
     */
    public Map<String, String> getFailures() {
        return failures;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "MetricsReport{" +
                "label='" + label + '\'' +
                ", size=" + series.size() +
                ", zScore=" + getZScoreAnomalies().map(AnomalyResult::getCount).orElse(null) +
                ", isolation=" + getIsolationAnomalies().map(AnomalyResult::getCount).orElse(null) +
                ", overlap=" + overlapCount +
                ", periodHours=" + getPeriodicity().map(PeriodicityResult::getPeriodHours).orElse(null) +
                ", peakHour=" + getDiurnal().map(DiurnalResult::getPeakHour).orElse(null) +
                ", troughHour=" + getDiurnal().map(DiurnalResult::getTroughHour).orElse(null) +
                ", reversals=" + getTrendReversals().map(TrendReversalResult::getReversalCount).orElse(null) +
                ", failures=" + failures.keySet() +
                '}';
    }
}
