package com.residencyinsight.core.analysis;

import com.residencyinsight.core.model.AnomalyFlagSet;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global z-score detector.
 *
 * <p>
 * The mean μ and sample standard deviation σ are computed once over the whole
 * series, outliers included. A sample {@code x} is flagged when
 * {@code |x - μ| / σ > threshold}.
 * </p>
 *
 * <h3>Constant series</h3>
 * <p>
 * When σ is zero there is no deviation to measure; the detector reports no
 * anomalies instead of dividing by zero.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements SeriesAnalyzer<AnomalyResult> {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    public static final String NAME = "zscore";

    private final double threshold;

    /**
     * @param threshold number of standard deviations; must be positive
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public AnomalyResult analyze(TimeSeries series) {
        double[] values = SeriesAnalyzer.definedValues(series, NAME);

        SummaryStatistics stats = new SummaryStatistics();
        for (double v : values) {
            stats.addValue(v);
        }
        double mean = stats.getMean();
        double stddev = stats.getStandardDeviation();

        if (values.length < 2 || stddev == 0) {
            LOG.debug("System [{}]: zero variance over {} sample(s), no z-score anomalies",
                    series.getLabel(), values.length);
            return new AnomalyResult(NAME, AnomalyFlagSet.none(values.length));
        }

        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(values[i] - mean) / stddev > threshold;
        }

        AnomalyResult result = new AnomalyResult(NAME, AnomalyFlagSet.of(flags));
        LOG.debug("System [{}]: {} z-score anomalies (mean={}, stddev={}, threshold={})",
                series.getLabel(), result.getCount(), mean, stddev, threshold);
        return result;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public double getThreshold() {
        return threshold;
    }
}
