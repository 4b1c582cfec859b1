package com.residencyinsight.core.analysis;

import com.residencyinsight.core.SeriesFixtures;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestDetector}.
 */
class IsolationForestDetectorTest {

    private IsolationForestDetector detector;

    @BeforeEach
    void setUp() {
        detector = new IsolationForestDetector(0.01, 100, 256, 42L);
    }

    @Test
    @DisplayName("Should flag the injected spike and stay within the contamination budget")
    void shouldFlagSpike() {
        TimeSeries series = SeriesFixtures.spike(700);

        AnomalyResult result = detector.analyze(series);

        assertThat(result.getFlags().isFlagged(700)).isTrue();
        assertThat(result.getCount()).isBetween(1, (int) Math.ceil(0.01 * series.size()));
    }

    @Test
    @DisplayName("Should flag roughly the contamination fraction of a noisy series")
    void shouldApproximateContamination() {
        Random random = new Random(7);
        TimeSeries series = SeriesFixtures.minutes("noise", 2880, i -> 50 + 5 * random.nextGaussian());

        AnomalyResult result = detector.analyze(series);

        assertThat(result.getCount()).isBetween(10, 29);
    }

    @Test
    @DisplayName("Should flag the extreme values of a noisy series")
    void shouldFlagExtremes() {
        Random random = new Random(11);
        double[] values = new double[2000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian();
        }
        values[100] = 25;
        values[1500] = -25;

        AnomalyResult result = detector.analyze(SeriesFixtures.of(values));

        assertThat(result.getFlags().isFlagged(100)).isTrue();
        assertThat(result.getFlags().isFlagged(1500)).isTrue();
    }

    @Test
    @DisplayName("Should produce identical flags for identical input and seed")
    void shouldBeDeterministic() {
        Random random = new Random(3);
        TimeSeries series = SeriesFixtures.minutes("noise", 1500, i -> random.nextDouble() * 100);

        AnomalyResult first = detector.analyze(series);
        AnomalyResult second = new IsolationForestDetector(0.01, 100, 256, 42L).analyze(series);

        assertThat(second.getFlags()).isEqualTo(first.getFlags());
    }

    @Test
    @DisplayName("Should report no anomalies for a constant series")
    void shouldIgnoreConstantSeries() {
        assertThat(detector.analyze(SeriesFixtures.constant(1000, 50)).getCount()).isZero();
    }

    @Test
    @DisplayName("Should not fit a single sample")
    void shouldHandleSingleSample() {
        AnomalyResult result = detector.analyze(SeriesFixtures.of(5));
        assertThat(result.getCount()).isZero();
        assertThat(result.getFlags().length()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject contamination outside (0, 0.5]")
    void shouldRejectInvalidContamination() {
        assertThatThrownBy(() -> new IsolationForestDetector(0.6, 100, 256, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contamination");
    }
}
