package com.residencyinsight.core.analysis;

import com.residencyinsight.core.exception.DegenerateSeriesException;
import com.residencyinsight.core.model.FrequencySpectrum;
import com.residencyinsight.core.model.PeriodicityResult;
import com.residencyinsight.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the dominant cycle of a series from its magnitude spectrum.
 *
 * <p>
 * The series is demeaned and transformed with a real-input DFT. Bin {@code j}
 * of an {@code n}-sample series with step Δt has frequency
 * {@code j / (n·Δt)} cycles per minute. The DC bin is skipped; the strongest
 * remaining bin (lowest index on a tie) gives the dominant period
 * {@code 1 / frequency}.
 * </p>
 *
 * <p>
 * A constant series has no cycle at all and is rejected with
 * {@link DegenerateSeriesException} rather than reporting the reciprocal of
 * the lowest bin.
 * </p>
 *
 * @since 1.0.0
 */
public class PeriodicityAnalyzer implements SeriesAnalyzer<PeriodicityResult> {

    private static final Logger LOG = LoggerFactory.getLogger(PeriodicityAnalyzer.class);

    public static final String NAME = "periodicity";

    @Override
    public PeriodicityResult analyze(TimeSeries series) {
        double[] values = SeriesAnalyzer.definedValues(series, NAME);
        int n = values.length;
        if (n < 2) {
            throw new DegenerateSeriesException("System '" + series.getLabel()
                    + "': at least 2 samples are needed for a spectrum, got " + n);
        }

        SummaryStatistics stats = new SummaryStatistics();
        for (double v : values) {
            stats.addValue(v);
        }
        if (stats.getVariance() == 0) {
            throw new DegenerateSeriesException("System '" + series.getLabel()
                    + "': constant series has no dominant period");
        }

        double mean = stats.getMean();
        double[] demeaned = new double[n];
        for (int i = 0; i < n; i++) {
            demeaned[i] = values[i] - mean;
        }

        double[] magnitudes = SpectralTransform.realMagnitudes(demeaned);
        double spanMinutes = n * series.stepMinutes();
        double[] frequencies = new double[magnitudes.length];
        for (int j = 0; j < frequencies.length; j++) {
            frequencies[j] = j / spanMinutes;
        }

        int dominant = 1;
        for (int j = 2; j < magnitudes.length; j++) {
            if (magnitudes[j] > magnitudes[dominant]) {
                dominant = j;
            }
        }
        if (!(magnitudes[dominant] > 0)) {
            throw new DegenerateSeriesException("System '" + series.getLabel()
                    + "': spectrum carries no energy outside the DC bin");
        }

        PeriodicityResult result = new PeriodicityResult(dominant, frequencies[dominant],
                new FrequencySpectrum(frequencies, magnitudes));
        LOG.debug("System [{}]: dominant bin {} of {}, period {} h",
                series.getLabel(), dominant, magnitudes.length - 1, result.getPeriodHours());
        return result;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
