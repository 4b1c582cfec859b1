package com.residencyinsight.core.pipeline;

import com.residencyinsight.core.SeriesFixtures;
import com.residencyinsight.core.analysis.PeriodicityAnalyzer;
import com.residencyinsight.core.config.AnalyticsConfig;
import com.residencyinsight.core.exception.EmptyInputException;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.MetricsReport;
import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link AnalyticsPipeline}.
 */
class AnalyticsPipelineTest {

    private AnalyticsPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new AnalyticsPipeline(AnalyticsConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("Two noisy daily cycles should produce a complete report")
    void shouldProduceCompleteReport() {
        Random random = new Random(21);
        TimeSeries raw = SeriesFixtures.minutes("sys-a", 2 * SeriesFixtures.MINUTES_PER_DAY,
                i -> 50 + 20 * SeriesFixtures.sine(i, SeriesFixtures.MINUTES_PER_DAY) + random.nextGaussian());

        MetricsReport report = pipeline.run("sys-a", SeriesFixtures.samples(raw));

        assertThat(report.isComplete()).isTrue();
        assertThat(report.getLabel()).isEqualTo("sys-a");
        assertThat(report.getSeries().size()).isEqualTo(2880);
        assertThat(report.getMeanValue()).isCloseTo(50.0, within(1.0));
        assertThat(report.getRollingMean()).hasSize(2880);
        assertThat(report.getPeriodicity()).get()
                .satisfies(p -> assertThat(p.getPeriodHours()).isCloseTo(24.0, within(1e-9)));
        assertThat(report.getDiurnal()).get()
                .satisfies(d -> {
                    // hours 5 and 6 straddle the crest symmetrically, noise decides between them
                    assertThat(d.getPeakHour()).isBetween(5, 6);
                    assertThat(d.getTroughHour()).isBetween(17, 18);
                });
        assertThat(report.getTrendReversals()).isPresent();

        int zScore = report.getZScoreAnomalies().map(AnomalyResult::getCount).orElseThrow();
        int isolation = report.getIsolationAnomalies().map(AnomalyResult::getCount).orElseThrow();
        assertThat(report.getOverlapCount().getAsInt()).isBetween(0, Math.min(zScore, isolation));
    }

    @Test
    @DisplayName("Spike scenario should be flagged by both detectors")
    void shouldDetectSpikeWithBothDetectors() {
        MetricsReport report = pipeline.run("spike", SeriesFixtures.samples(SeriesFixtures.spike(1000)));

        assertThat(report.getZScoreAnomalies()).get()
                .satisfies(r -> assertThat(r.getFlags().flaggedIndices()).containsExactly(1000));
        assertThat(report.getIsolationAnomalies()).get()
                .satisfies(r -> assertThat(r.getFlags().isFlagged(1000)).isTrue());
        assertThat(report.getOverlapCount()).hasValue(1);
    }

    @Test
    @DisplayName("Constant series should record a periodicity failure and keep the other results")
    void shouldIsolatePeriodicityFailure() {
        MetricsReport report = pipeline.run("flat", SeriesFixtures.samples(SeriesFixtures.constant(2000, 50)));

        assertThat(report.getPeriodicity()).isEmpty();
        assertThat(report.getFailures()).containsOnlyKeys(PeriodicityAnalyzer.NAME);
        assertThat(report.getFailures().get(PeriodicityAnalyzer.NAME)).startsWith("DegenerateSeriesException");
        assertThat(report.getZScoreAnomalies()).get().extracting(AnomalyResult::getCount).isEqualTo(0);
        assertThat(report.getIsolationAnomalies()).get().extracting(AnomalyResult::getCount).isEqualTo(0);
        assertThat(report.getOverlapCount()).hasValue(0);
        assertThat(report.getDiurnal()).isPresent();
        assertThat(report.getTrendReversals()).get()
                .satisfies(t -> assertThat(t.getReversalCount()).isZero());
    }

    @Test
    @DisplayName("Series shorter than one day should report no trend reversals")
    void shouldHandleShortSeries() {
        Random random = new Random(4);
        TimeSeries raw = SeriesFixtures.minutes("short", 600, i -> random.nextDouble());

        MetricsReport report = pipeline.run("short", SeriesFixtures.samples(raw));

        assertThat(report.getTrendReversals()).get()
                .satisfies(t -> assertThat(t.getReversalCount()).isZero());
        assertThat(report.isComplete()).isTrue();
    }

    @Test
    @DisplayName("Undefined boundary samples should be trimmed before analysis")
    void shouldTrimUndefinedBoundaries() {
        List<Sample> samples = new ArrayList<>(SeriesFixtures.samples(SeriesFixtures.minutes("gappy", 200, i -> i % 7)));
        samples.set(0, Sample.of(samples.get(0).getTimestamp(), Double.NaN));
        samples.set(199, Sample.of(samples.get(199).getTimestamp(), Double.NaN));

        MetricsReport report = pipeline.run("gappy", samples);

        assertThat(report.getSeries().size()).isEqualTo(198);
        assertThat(report.getSeries().getStart()).isEqualTo(SeriesFixtures.MIDNIGHT.plusMinutes(1));
    }

    @Test
    @DisplayName("No samples should fail fast")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> pipeline.run("none", List.of()))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Only undefined values should fail fast")
    void shouldRejectAllUndefined() {
        List<Sample> samples = List.of(
                Sample.of(SeriesFixtures.MIDNIGHT, Double.NaN),
                Sample.of(SeriesFixtures.MIDNIGHT.plusMinutes(1), Double.NaN));

        assertThatThrownBy(() -> pipeline.run("none", samples))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Cached runs should load the source once")
    void shouldReuseCachedSeries() {
        AtomicInteger loads = new AtomicInteger();
        List<Sample> samples = SeriesFixtures.samples(SeriesFixtures.spike(10));

        MetricsReport first = pipeline.run("jan.csv", "sys-a", () -> {
            loads.incrementAndGet();
            return samples;
        });
        MetricsReport second = pipeline.run("jan.csv", "sys-a", () -> {
            loads.incrementAndGet();
            return samples;
        });

        assertThat(loads).hasValue(1);
        assertThat(second.getSeries()).isSameAs(first.getSeries());
        assertThat(pipeline.getCache().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Caller-supplied executor should stay open after close")
    void shouldNotShutDownForeignExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            AnalyticsPipeline shared = new AnalyticsPipeline(AnalyticsConfig.defaults(), executor, new SeriesCache());
            MetricsReport report = shared.run("spike", SeriesFixtures.samples(SeriesFixtures.spike(5)));
            shared.close();

            assertThat(report.getZScoreAnomalies()).isPresent();
            assertThat(executor.isShutdown()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Invalid configuration should be rejected at construction")
    void shouldRejectInvalidConfig() {
        AnalyticsConfig config = AnalyticsConfig.defaults();
        config.setContamination(0.9);

        assertThatThrownBy(() -> new AnalyticsPipeline(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination");
    }
}
