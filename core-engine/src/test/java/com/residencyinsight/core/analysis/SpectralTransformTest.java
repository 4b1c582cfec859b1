package com.residencyinsight.core.analysis;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SpectralTransform}.
 */
class SpectralTransformTest {

    @ParameterizedTest(name = "length {0}")
    @ValueSource(ints = {2, 7, 16, 37, 100, 1000})
    @DisplayName("Should agree with a direct DFT for any length")
    void shouldMatchDirectDft(int length) {
        Random random = new Random(length);
        double[] signal = new double[length];
        for (int i = 0; i < length; i++) {
            signal[i] = random.nextDouble() * 10 - 5;
        }

        Complex[] fast = SpectralTransform.transform(signal);
        Complex[] direct = directDft(signal);

        assertThat(fast).hasSize(length);
        for (int k = 0; k < length; k++) {
            assertThat(fast[k].getReal()).as("re[%d]", k).isCloseTo(direct[k].getReal(), within(1e-6));
            assertThat(fast[k].getImaginary()).as("im[%d]", k).isCloseTo(direct[k].getImaginary(), within(1e-6));
        }
    }

    @Test
    @DisplayName("Pure cosine should put n/2 magnitude into its bin")
    void shouldLocateCosine() {
        double[] signal = new double[10];
        for (int t = 0; t < signal.length; t++) {
            signal[t] = Math.cos(2 * Math.PI * 3 * t / 10);
        }

        double[] magnitudes = SpectralTransform.realMagnitudes(signal);

        assertThat(magnitudes).hasSize(6);
        assertThat(magnitudes[3]).isCloseTo(5.0, within(1e-9));
        assertThat(magnitudes[1]).isCloseTo(0.0, within(1e-9));
        assertThat(magnitudes[0]).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should return no bins for empty input")
    void shouldHandleEmptyInput() {
        assertThat(SpectralTransform.realMagnitudes(new double[0])).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Complex[] directDft(double[] signal) {
        int n = signal.length;
        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            double re = 0;
            double im = 0;
            for (int t = 0; t < n; t++) {
                double angle = -2 * Math.PI * (((long) k * t) % n) / n;
                re += signal[t] * Math.cos(angle);
                im += signal[t] * Math.sin(angle);
            }
            out[k] = new Complex(re, im);
        }
        return out;
    }
}
