/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.math;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * FFT based helpers operating on one real spectrum at a time. Transform lengths are powers of two.
 */
public final class Fourier {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private Fourier() {}

    public static int nextPowerOfTwo(int n) {
        if (n <= 1) return 1;
        return Integer.highestOneBit(n - 1) << 1;
    }

    /** Symmetric Hann window {@code 0.5 - 0.5 cos(2 pi n / (N - 1))}. */
    public static double[] hann(int length) {
        double[] w = new double[length];
        if (length == 1) {
            w[0] = 1.0;
            return w;
        }
        for (int i = 0; i < length; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / (length - 1));
        }
        return w;
    }

    /**
     * Autocorrelation of {@code x} for lags 0..N-1, normalized by the zero-lag value. The signal is
     * zero padded to a power of two at least {@code 2N - 1} long so the circular result equals the
     * linear one for those lags. A signal with zero energy yields NaN at every lag.
     */
    public static double[] normalizedAutocorrelation(double[] x) {
        int n = x.length;
        int size = nextPowerOfTwo(2 * n - 1);
        Complex[] spectrum = FFT.transform(zeroPadded(x, size), TransformType.FORWARD);
        double[] power = new double[size];
        for (int i = 0; i < size; i++) {
            Complex c = spectrum[i];
            power[i] = c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
        }
        Complex[] acov = FFT.transform(power, TransformType.INVERSE);
        double zero = acov[0].getReal();
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = acov[i].getReal() / zero;
        }
        return out;
    }

    /**
     * One-sided magnitude spectrum of {@code x} zero padded to {@code size}, divided by the signal
     * length. Returns {@code size / 2 + 1} bins.
     */
    public static double[] oneSidedMagnitude(double[] x, int size) {
        Complex[] spectrum = FFT.transform(zeroPadded(x, size), TransformType.FORWARD);
        double[] out = new double[size / 2 + 1];
        for (int i = 0; i < out.length; i++) {
            out[i] = spectrum[i].abs() / x.length;
        }
        return out;
    }

    private static double[] zeroPadded(double[] x, int size) {
        double[] padded = new double[size];
        System.arraycopy(x, 0, padded, 0, Math.min(x.length, size));
        return padded;
    }
}
