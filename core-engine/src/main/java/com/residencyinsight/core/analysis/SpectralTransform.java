package com.residencyinsight.core.analysis;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Objects;

/**
 * Discrete Fourier transform of real input of any length.
 *
 * <p>
 * Power-of-two lengths go straight to Commons Math's radix-2 FFT. Other
 * lengths are rewritten as a circular convolution (Bluestein's chirp-z
 * algorithm) and evaluated with power-of-two FFTs, so the cost stays
 * {@code O(n log n)} and the bins are exactly those of an {@code n}-point DFT;
 * no zero padding leaks into the result.
 * </p>
 */
final class SpectralTransform {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private SpectralTransform() {
        // utility class
    }

    /**
     * Magnitudes of the non-negative frequency bins {@code 0..n/2}.
     *
     * @param signal real input
     * @return {@code floor(n/2) + 1} magnitudes, empty for empty input
     */
    static double[] realMagnitudes(double[] signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (signal.length == 0) {
            return new double[0];
        }
        Complex[] bins = transform(signal);
        double[] magnitudes = new double[signal.length / 2 + 1];
        for (int j = 0; j < magnitudes.length; j++) {
            magnitudes[j] = bins[j].abs();
        }
        return magnitudes;
    }

    /**
     * Full forward DFT, {@code X[k] = Σ x[t]·e^(-2πikt/n)}.
     */
    static Complex[] transform(double[] signal) {
        int n = signal.length;
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return FFT.transform(signal, TransformType.FORWARD);
        }
        return bluestein(signal);
    }

    private static Complex[] bluestein(double[] signal) {
        int n = signal.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        // chirp[k] = e^(-iπk²/n); k² is reduced mod 2n to keep the angle exact
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int k = 0; k < n; k++) {
            double angle = Math.PI * (((long) k * k) % period) / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int i = 0; i < m; i++) {
            a[i] = Complex.ZERO;
            b[i] = Complex.ZERO;
        }
        for (int k = 0; k < n; k++) {
            a[k] = chirp[k].multiply(signal[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            Complex c = chirp[k].conjugate();
            b[k] = c;
            b[m - k] = c;
        }

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        Complex[] fb = FFT.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        Complex[] convolution = FFT.transform(product, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            out[k] = chirp[k].multiply(convolution[k]);
        }
        return out;
    }
}
