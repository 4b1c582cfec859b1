package com.residencyinsight.core.analysis;

import com.residencyinsight.core.model.AnomalyFlagSet;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unsupervised anomaly detector backed by an {@link IsolationForest}.
 *
 * <p>
 * Each sample is an independent one-dimensional observation; ordering plays
 * no part. The forest is fitted on the series itself and the decision
 * threshold is placed at the {@code contamination} quantile of the negated
 * training scores, so roughly that fraction of the easiest-to-isolate samples
 * is flagged. Samples tied with the threshold are not flagged, which means a
 * series with many identical values may yield fewer flags than the
 * contamination suggests.
 * </p>
 *
 * <p>
 * Results are deterministic for a given series and seed.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements SeriesAnalyzer<AnomalyResult> {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final String NAME = "isolation_forest";

    private final double contamination;
    private final int treeCount;
    private final int maxSampleSize;
    private final long seed;

    /**
     * @param contamination expected anomaly fraction in {@code (0, 0.5]}
     * @param treeCount     number of isolation trees
     * @param maxSampleSize upper bound on each tree's sub-sample
     * @param seed          random seed
     * @throws IllegalArgumentException if any parameter is out of range
     */
    public IsolationForestDetector(double contamination, int treeCount, int maxSampleSize, long seed) {
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be >= 1, got: " + treeCount);
        }
        if (maxSampleSize < 2) {
            throw new IllegalArgumentException("maxSampleSize must be >= 2, got: " + maxSampleSize);
        }
        this.contamination = contamination;
        this.treeCount = treeCount;
        this.maxSampleSize = maxSampleSize;
        this.seed = seed;
    }

    @Override
    public AnomalyResult analyze(TimeSeries series) {
        double[] values = SeriesAnalyzer.definedValues(series, NAME);
        if (values.length < 2) {
            LOG.debug("System [{}]: {} sample(s) is too few to fit an isolation forest",
                    series.getLabel(), values.length);
            return new AnomalyResult(NAME, AnomalyFlagSet.none(values.length));
        }

        IsolationForest forest = IsolationForest.fit(values, treeCount, maxSampleSize, seed);

        double[] negatedScores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            negatedScores[i] = -forest.score(values[i]);
        }
        double offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negatedScores, 100.0 * contamination);

        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = negatedScores[i] < offset;
        }

        AnomalyResult result = new AnomalyResult(NAME, AnomalyFlagSet.of(flags));
        LOG.debug("System [{}]: {} isolation-forest anomalies (trees={}, sampleSize={}, threshold={})",
                series.getLabel(), result.getCount(), forest.getTreeCount(), forest.getSampleSize(), -offset);
        return result;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public double getContamination() {
        return contamination;
    }

    public long getSeed() {
        return seed;
    }
}
