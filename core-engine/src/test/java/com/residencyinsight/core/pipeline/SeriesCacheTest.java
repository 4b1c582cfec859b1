package com.residencyinsight.core.pipeline;

import com.residencyinsight.core.SeriesFixtures;
import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeriesCache}.
 */
class SeriesCacheTest {

    private static final Duration STEP = Duration.ofMinutes(1);

    private SeriesCache cache;
    private AtomicInteger loads;
    private Supplier<List<Sample>> loader;

    @BeforeEach
    void setUp() {
        cache = new SeriesCache();
        loads = new AtomicInteger();
        List<Sample> samples = SeriesFixtures.samples(SeriesFixtures.minutes("raw", 10, i -> i));
        loader = () -> {
            loads.incrementAndGet();
            return samples;
        };
    }

    @Test
    @DisplayName("Should load each (source, system) only once")
    void shouldLoadOnce() {
        TimeSeries first = cache.getOrResample("jan.csv", "sys-a", STEP, loader);
        TimeSeries second = cache.getOrResample("jan.csv", "sys-a", STEP, loader);

        assertThat(second).isSameAs(first);
        assertThat(loads).hasValue(1);
        assertThat(first.getLabel()).isEqualTo("sys-a");
        assertThat(first.size()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should keep separate entries per system and per step")
    void shouldSeparateKeys() {
        cache.getOrResample("jan.csv", "sys-a", STEP, loader);
        cache.getOrResample("jan.csv", "sys-b", STEP, loader);
        cache.getOrResample("jan.csv", "sys-a", Duration.ofMinutes(5), loader);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(loads).hasValue(3);
    }

    @Test
    @DisplayName("Invalidation should force a reload")
    void shouldReloadAfterInvalidate() {
        cache.getOrResample("jan.csv", "sys-a", STEP, loader);
        cache.getOrResample("jan.csv", "sys-a", Duration.ofMinutes(5), loader);
        cache.getOrResample("feb.csv", "sys-a", STEP, loader);

        assertThat(cache.invalidate("jan.csv", "sys-a")).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);

        cache.getOrResample("jan.csv", "sys-a", STEP, loader);
        assertThat(loads).hasValue(4);

        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
