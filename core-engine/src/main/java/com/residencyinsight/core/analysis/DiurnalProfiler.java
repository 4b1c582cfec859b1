package com.residencyinsight.core.analysis;

import com.residencyinsight.core.exception.EmptyInputException;
import com.residencyinsight.core.model.DiurnalResult;
import com.residencyinsight.core.model.HourlyProfile;
import com.residencyinsight.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Averages a series by hour of day and picks the peak and trough hours.
 *
 * <p>
 * Hours are read from the series' own wall-clock timestamps. When several
 * hours share the extreme mean, the lowest-numbered hour wins.
 * </p>
 *
 * @since 1.0.0
 */
public class DiurnalProfiler implements SeriesAnalyzer<DiurnalResult> {

    private static final Logger LOG = LoggerFactory.getLogger(DiurnalProfiler.class);

    public static final String NAME = "diurnal";

    @Override
    public DiurnalResult analyze(TimeSeries series) {
        double[] values = SeriesAnalyzer.definedValues(series, NAME);
        if (values.length == 0) {
            throw new EmptyInputException("System '" + series.getLabel() + "': no samples to profile");
        }

        double[] sums = new double[HourlyProfile.HOURS_PER_DAY];
        long[] counts = new long[HourlyProfile.HOURS_PER_DAY];
        for (int i = 0; i < values.length; i++) {
            int hour = series.timestampAt(i).getHour();
            sums[hour] += values[i];
            counts[hour]++;
        }

        double[] means = new double[HourlyProfile.HOURS_PER_DAY];
        int peak = -1;
        int trough = -1;
        for (int h = 0; h < HourlyProfile.HOURS_PER_DAY; h++) {
            if (counts[h] == 0) {
                means[h] = Double.NaN;
                continue;
            }
            means[h] = sums[h] / counts[h];
            if (peak < 0 || means[h] > means[peak]) {
                peak = h;
            }
            if (trough < 0 || means[h] < means[trough]) {
                trough = h;
            }
        }

        LOG.debug("System [{}]: peak hour {}, trough hour {}", series.getLabel(), peak, trough);
        return new DiurnalResult(new HourlyProfile(means, counts), peak, trough);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
