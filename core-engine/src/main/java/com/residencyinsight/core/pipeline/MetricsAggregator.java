package com.residencyinsight.core.pipeline;

import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.DiurnalResult;
import com.residencyinsight.core.model.MetricsReport;
import com.residencyinsight.core.model.PeriodicityResult;
import com.residencyinsight.core.model.TimeSeries;
import com.residencyinsight.core.model.TrendReversalResult;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Merges analyzer outcomes into one {@link MetricsReport}.
 *
 * <p>
 * Failed outcomes become absent report fields plus an entry in
 * {@link MetricsReport#getFailures()}. The overlap count is the intersection
 * of the two anomaly flag sets and is only reported when both detectors
 * succeeded. The aggregator also derives the series overview shown next to
 * the analyzer results: the overall mean and a trailing rolling mean.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsAggregator.class);

    private final int rollingWindow;

    /**
     * @param rollingWindow trailing window of the rolling mean, in samples
     */
    public MetricsAggregator(int rollingWindow) {
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("rollingWindow must be >= 1, got: " + rollingWindow);
        }
        this.rollingWindow = rollingWindow;
    }

    public MetricsReport aggregate(TimeSeries series,
                                   AnalyzerOutcome<AnomalyResult> zScore,
                                   AnalyzerOutcome<AnomalyResult> isolation,
                                   AnalyzerOutcome<PeriodicityResult> periodicity,
                                   AnalyzerOutcome<DiurnalResult> diurnal,
                                   AnalyzerOutcome<TrendReversalResult> trend) {
        Objects.requireNonNull(series, "series must not be null");

        double[] values = series.getValues();
        SummaryStatistics stats = new SummaryStatistics();
        for (double v : values) {
            stats.addValue(v);
        }

        MetricsReport.Builder builder = MetricsReport.builder()
                .label(series.getLabel())
                .series(series)
                .meanValue(stats.getMean())
                .rollingMean(rollingMean(values, rollingWindow));

        zScore.getResult().ifPresent(builder::zScoreAnomalies);
        isolation.getResult().ifPresent(builder::isolationAnomalies);
        periodicity.getResult().ifPresent(builder::periodicity);
        diurnal.getResult().ifPresent(builder::diurnal);
        trend.getResult().ifPresent(builder::trendReversals);

        if (zScore.isSuccess() && isolation.isSuccess()) {
            int overlap = zScore.getResult().orElseThrow().getFlags()
                    .intersectionCount(isolation.getResult().orElseThrow().getFlags());
            builder.overlapCount(overlap);
        }

        for (AnalyzerOutcome<?> outcome : List.<AnalyzerOutcome<?>>of(zScore, isolation, periodicity, diurnal, trend)) {
            outcome.getFailure().ifPresent(message -> builder.failure(outcome.getAnalyzerName(), message));
        }

        MetricsReport report = builder.build();
        LOG.info("System [{}]: {}", series.getLabel(), report);
        return report;
    }

    /**
     * Trailing mean over up to {@code window} samples; the first samples use
     * whatever history is available.
     */
    static double[] rollingMean(double[] values, int window) {
        double[] out = new double[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            out[i] = sum / Math.min(i + 1, window);
        }
        return out;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }
}
