package com.residencyinsight.core.analysis;

import com.residencyinsight.core.exception.InsufficientWindowException;
import com.residencyinsight.core.model.AroonPair;
import com.residencyinsight.core.model.TimeSeries;
import com.residencyinsight.core.model.TrendReversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Trend-reversal detector based on the Aroon indicator.
 *
 * <p>
 * For every index {@code i >= W - 1} the trailing window of {@code W} samples
 * ending at {@code i} is inspected. With {@code pMax} and {@code pMin} the
 * number of steps back from {@code i} to the window's most recent maximum and
 * minimum:
 * </p>
 *
 * <pre>
 * up(i)   = 100 × (W - 1 - pMax) / W
 * down(i) = 100 × (W - 1 - pMin) / W
 * </pre>
 *
 * <p>
 * A reversal is counted at {@code i} when up crosses strictly above down:
 * {@code up(i) > down(i)} and {@code up(i-1) <= down(i-1)}. The first defined
 * index has no predecessor and never counts.
 * </p>
 *
 * <h3>Implementation</h3>
 * <p>
 * The window extremes are tracked with two monotonic deques of indices, giving
 * {@code O(n)} time regardless of {@code W}. Ties resolve to the most recent
 * occurrence because an older equal value is evicted when a newer one
 * arrives.
 * </p>
 *
 * <h3>Short series</h3>
 * <p>
 * A series shorter than {@code W} is not an error: {@link #analyze} returns an
 * all-undefined indicator and zero reversals.
 * </p>
 *
 * @since 1.0.0
 */
public class AroonTrendDetector implements SeriesAnalyzer<TrendReversalResult> {

    private static final Logger LOG = LoggerFactory.getLogger(AroonTrendDetector.class);

    public static final String NAME = "trend_reversal";

    private final int window;

    /**
     * @param window window length in samples; at least 2
     * @throws IllegalArgumentException if {@code window} is below 2
     */
    public AroonTrendDetector(int window) {
        if (window < 2) {
            throw new IllegalArgumentException("window must be >= 2, got: " + window);
        }
        this.window = window;
    }

    @Override
    public TrendReversalResult analyze(TimeSeries series) {
        double[] values = SeriesAnalyzer.definedValues(series, NAME);

        AroonPair indicator;
        try {
            indicator = computeIndicator(values, window);
        } catch (InsufficientWindowException e) {
            LOG.debug("System [{}]: {} - no trend reversals reported", series.getLabel(), e.getMessage());
            return TrendReversalResult.insufficient(window, values.length);
        }

        int[] reversals = findCrossovers(indicator);
        LOG.debug("System [{}]: {} trend reversal(s) with window {}",
                series.getLabel(), reversals.length, window);
        return new TrendReversalResult(indicator, reversals);
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getWindow() {
        return window;
    }

    // ---------------------------------------------------------------
    // Indicator
    // ---------------------------------------------------------------

    /**
     * Compute Aroon-Up and Aroon-Down.
     *
     * @param values fully defined values
     * @param window window length
     * @return indicator, {@code NaN} before index {@code window - 1}
     * @throws InsufficientWindowException if {@code values} is shorter than
     *                                     {@code window}
     */
    static AroonPair computeIndicator(double[] values, int window) {
        int n = values.length;
        if (n < window) {
            throw new InsufficientWindowException(window, n);
        }

        double[] up = new double[n];
        double[] down = new double[n];
        Arrays.fill(up, 0, window - 1, Double.NaN);
        Arrays.fill(down, 0, window - 1, Double.NaN);

        Deque<Integer> maxima = new ArrayDeque<>();
        Deque<Integer> minima = new ArrayDeque<>();

        for (int i = 0; i < n; i++) {
            double v = values[i];
            while (!maxima.isEmpty() && values[maxima.peekLast()] <= v) {
                maxima.pollLast();
            }
            maxima.addLast(i);
            while (!minima.isEmpty() && values[minima.peekLast()] >= v) {
                minima.pollLast();
            }
            minima.addLast(i);

            int windowStart = i - window + 1;
            while (maxima.peekFirst() < windowStart) {
                maxima.pollFirst();
            }
            while (minima.peekFirst() < windowStart) {
                minima.pollFirst();
            }

            if (windowStart >= 0) {
                int stepsSinceMax = i - maxima.peekFirst();
                int stepsSinceMin = i - minima.peekFirst();
                up[i] = 100.0 * (window - 1 - stepsSinceMax) / window;
                down[i] = 100.0 * (window - 1 - stepsSinceMin) / window;
            }
        }
        return new AroonPair(window, up, down);
    }

    /**
     * @return indices where Aroon-Up crosses strictly above Aroon-Down
     */
    static int[] findCrossovers(AroonPair indicator) {
        int n = indicator.length();
        int[] buffer = new int[Math.max(0, n - indicator.getWindow() + 1)];
        int count = 0;
        for (int i = indicator.getWindow(); i < n; i++) {
            boolean above = indicator.upAt(i) > indicator.downAt(i);
            boolean previouslyAbove = indicator.upAt(i - 1) > indicator.downAt(i - 1);
            if (above && !previouslyAbove) {
                buffer[count++] = i;
            }
        }
        return Arrays.copyOf(buffer, count);
    }
}
