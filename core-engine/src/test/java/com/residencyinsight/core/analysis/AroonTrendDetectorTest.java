package com.residencyinsight.core.analysis;

import com.residencyinsight.core.SeriesFixtures;
import com.residencyinsight.core.exception.InsufficientWindowException;
import com.residencyinsight.core.model.AroonPair;
import com.residencyinsight.core.model.TrendReversalResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AroonTrendDetector}.
 */
class AroonTrendDetectorTest {

    @Test
    @DisplayName("Should compute the indicator by hand for a short zig-zag")
    void shouldComputeKnownValues() {
        double[] values = {1, 2, 3, 2, 1, 2, 3};

        AroonPair pair = AroonTrendDetector.computeIndicator(values, 3);

        assertThat(pair.isDefined(1)).isFalse();
        assertThat(pair.getUp()).containsExactly(
                new double[] {Double.NaN, Double.NaN, 200.0 / 3, 100.0 / 3, 0, 200.0 / 3, 200.0 / 3},
                within(1e-9));
        assertThat(pair.getDown()).containsExactly(
                new double[] {Double.NaN, Double.NaN, 0, 200.0 / 3, 200.0 / 3, 100.0 / 3, 0},
                within(1e-9));
        assertThat(AroonTrendDetector.findCrossovers(pair)).containsExactly(5);
    }

    @Test
    @DisplayName("Indicator should stay within [0, 100] on noisy data")
    void shouldStayWithinBounds() {
        Random random = new Random(5);
        TrendReversalResult result = new AroonTrendDetector(25)
                .analyze(SeriesFixtures.minutes("noise", 1000, i -> random.nextGaussian()));

        AroonPair pair = result.getIndicator();
        for (int i = 24; i < pair.length(); i++) {
            assertThat(pair.upAt(i)).isBetween(0.0, 100.0);
            assertThat(pair.downAt(i)).isBetween(0.0, 100.0);
        }
        assertThat(pair.isDefined(23)).isFalse();
        assertThat(result.getReversalCount()).isPositive();
        for (int index : result.getReversalIndices()) {
            assertThat(index).isGreaterThanOrEqualTo(25);
        }
    }

    @Test
    @DisplayName("Constant series should give equal Up and Down and no reversals")
    void shouldHandleConstantSeries() {
        TrendReversalResult result = new AroonTrendDetector(5).analyze(SeriesFixtures.constant(50, 7));

        AroonPair pair = result.getIndicator();
        for (int i = 4; i < pair.length(); i++) {
            assertThat(pair.upAt(i)).isEqualTo(pair.downAt(i)).isEqualTo(80.0);
        }
        assertThat(result.getReversalCount()).isZero();
    }

    @Test
    @DisplayName("Steady rise should hold Up at its maximum")
    void shouldTrackRisingSeries() {
        AroonPair pair = AroonTrendDetector.computeIndicator(new double[] {1, 2, 3, 4, 5, 6}, 4);

        assertThat(pair.upAt(5)).isEqualTo(75.0);
        assertThat(pair.downAt(5)).isZero();
    }

    @Test
    @DisplayName("Series shorter than the window should yield an empty result, not an error")
    void shouldReturnEmptyResultForShortSeries() {
        TrendReversalResult result = new AroonTrendDetector(1440).analyze(SeriesFixtures.constant(100, 1));

        assertThat(result.getReversalCount()).isZero();
        assertThat(result.getIndicator().length()).isEqualTo(100);
        assertThat(result.getIndicator().getUp()).containsOnly(Double.NaN);
    }

    @Test
    @DisplayName("Indicator computation should signal an insufficient window")
    void shouldSignalInsufficientWindow() {
        assertThatThrownBy(() -> AroonTrendDetector.computeIndicator(new double[] {1, 2}, 3))
                .isInstanceOf(InsufficientWindowException.class);
    }

    @Test
    @DisplayName("Should reject a window shorter than two samples")
    void shouldRejectTinyWindow() {
        assertThatThrownBy(() -> new AroonTrendDetector(1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
