package com.residencyinsight.core.analysis;

import com.residencyinsight.core.config.AnalyticsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyzerFactory}.
 */
class AnalyzerFactoryTest {

    private AnalyticsConfig config;

    @BeforeEach
    void setUp() {
        config = AnalyticsConfig.defaults();
    }

    @Test
    @DisplayName("Should create ZScoreDetector with the configured threshold")
    void shouldCreateZScoreDetector() {
        config.setDeviationThreshold(2.5);

        SeriesAnalyzer<?> analyzer = AnalyzerFactory.create("zscore", config);

        assertThat(analyzer).isInstanceOf(ZScoreDetector.class);
        assertThat(((ZScoreDetector) analyzer).getThreshold()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should create IsolationForestDetector with the configured seed")
    void shouldCreateIsolationForestDetector() {
        config.setRandomSeed(99L);

        SeriesAnalyzer<?> analyzer = AnalyzerFactory.create("ISOLATION_FOREST", config);

        assertThat(analyzer).isInstanceOf(IsolationForestDetector.class);
        assertThat(((IsolationForestDetector) analyzer).getSeed()).isEqualTo(99L);
        assertThat(((IsolationForestDetector) analyzer).getContamination()).isEqualTo(0.01);
    }

    @Test
    @DisplayName("Should derive the Aroon window from the cadence")
    void shouldDeriveAroonWindow() {
        config.setCadenceSeconds(300);

        SeriesAnalyzer<?> analyzer = AnalyzerFactory.create("trend_reversal", config);

        assertThat(((AroonTrendDetector) analyzer).getWindow()).isEqualTo(288);
    }

    @Test
    @DisplayName("Explicit Aroon window should override the cadence")
    void shouldHonourExplicitAroonWindow() {
        config.setAroonWindow(30);

        assertThat(((AroonTrendDetector) AnalyzerFactory.trendReversal(config)).getWindow()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should create every analyzer in a fixed order")
    void shouldCreateAll() {
        List<SeriesAnalyzer<?>> analyzers = AnalyzerFactory.createAll(config);

        assertThat(analyzers).extracting(SeriesAnalyzer::getName)
                .containsExactlyElementsOf(AnalyzerFactory.ANALYZER_NAMES);
    }

    @Test
    @DisplayName("Should throw on unknown analyzer name")
    void shouldThrowOnUnknownName() {
        assertThatThrownBy(() -> AnalyzerFactory.create("prophet", config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown analyzer")
                .hasMessageContaining("prophet");
    }

    @Test
    @DisplayName("Should reject a null configuration")
    void shouldRejectNullConfig() {
        assertThatThrownBy(() -> AnalyzerFactory.zScore(null))
                .isInstanceOf(NullPointerException.class);
    }
}
