/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.math;

import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;

/**
 * Digital low-pass Butterworth filter obtained by bilinear transform of the analog prototype,
 * applied with zero phase by filtering forward and then backward.
 *
 * <p>The cutoff {@code wn} is normalized so that 1.0 is the Nyquist frequency. Coefficients
 * {@link #b()} and {@link #a()} are normalized with {@code a[0] == 1}. Instances are immutable and
 * may be shared between threads.</p>
 */
public final class ButterworthFilter {

    private final int order;
    private final double wn;
    private final double[] b;
    private final double[] a;
    private final double[] zi;

    private ButterworthFilter(int order, double wn, double[] b, double[] a) {
        this.order = order;
        this.wn = wn;
        this.b = b;
        this.a = a;
        this.zi = steadyStateInitialConditions(b, a);
    }

    /**
     * Designs a low-pass filter.
     *
     * @param order filter order, at least 1
     * @param wn    cutoff as a fraction of the Nyquist frequency, in (0, 1)
     */
    public static ButterworthFilter lowPass(int order, double wn) {
        if (order < 1) {
            throw new InvalidSettingsException("Filter order must be >= 1, got " + order);
        }
        if (!(wn > 0.0 && wn < 1.0)) {
            throw new InvalidSettingsException("Normalized cutoff must lie in (0, 1), got " + wn);
        }

        // analog prototype poles on the left half of the unit circle
        Complex[] poles = new Complex[order];
        for (int k = 0; k < order; k++) {
            double theta = Math.PI * (2 * k + order + 1) / (2.0 * order);
            poles[k] = Complex.unit(theta);
        }

        double fs = 2.0;
        double warped = 2.0 * fs * Math.tan(Math.PI * wn / fs);

        Complex[] zPoles = new Complex[order];
        Complex denom = Complex.ONE;
        double fs2 = 2.0 * fs;
        for (int k = 0; k < order; k++) {
            Complex p = poles[k].scale(warped);
            zPoles[k] = p.add(fs2).divide(p.negate().add(fs2));
            denom = denom.multiply(p.negate().add(fs2));
        }
        double gain = Math.pow(warped, order) / denom.real;

        double[] numerator = binomialCoefficients(order);
        for (int i = 0; i < numerator.length; i++) numerator[i] *= gain;

        double[] denominator = realPolynomial(zPoles);
        return new ButterworthFilter(order, wn, numerator, denominator);
    }

    public int order()  { return order; }
    public double wn()  { return wn; }
    public double[] b() { return b.clone(); }
    public double[] a() { return a.clone(); }

    /** Number of samples the signal is extended by on each side before filtering. */
    public int padLength(int signalLength) {
        return Math.min(3 * Math.max(a.length, b.length), signalLength - 1);
    }

    /**
     * Zero-phase filtering of one signal. The input is not modified.
     */
    public double[] filtfilt(double[] x) {
        int n = x.length;
        if (n < 2) {
            return x.clone();
        }
        int pad = padLength(n);
        double[] ext = oddExtension(x, pad);

        double[] state = scaled(zi, ext[0]);
        double[] forward = lfilter(ext, state);

        reverse(forward);
        state = scaled(zi, forward[0]);
        double[] backward = lfilter(forward, state);
        reverse(backward);

        return Arrays.copyOfRange(backward, pad, pad + n);
    }

    /**
     * Direct form II transposed filter with the given initial state. The state array is consumed.
     */
    double[] lfilter(double[] x, double[] state) {
        int m = a.length;
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double xi = x[i];
            double yi = b[0] * xi + (m > 1 ? state[0] : 0.0);
            for (int j = 1; j < m; j++) {
                double next = j < m - 1 ? state[j] : 0.0;
                state[j - 1] = b[j] * xi - a[j] * yi + next;
            }
            y[i] = yi;
        }
        return y;
    }

    static double[] oddExtension(double[] x, int pad) {
        int n = x.length;
        double[] ext = new double[n + 2 * pad];
        for (int i = 0; i < pad; i++) {
            ext[i] = 2.0 * x[0] - x[pad - i];
            ext[pad + n + i] = 2.0 * x[n - 1] - x[n - 2 - i];
        }
        System.arraycopy(x, 0, ext, pad, n);
        return ext;
    }

    /**
     * Initial state for a step response at steady state, solving
     * {@code (I - A^T) zi = b[1:] - a[1:] * b[0]} with {@code A} the companion matrix of {@code a}.
     */
    static double[] steadyStateInitialConditions(double[] b, double[] a) {
        int m = a.length - 1;
        if (m == 0) {
            return new double[0];
        }
        RealMatrix system = new Array2DRowRealMatrix(m, m);
        for (int i = 0; i < m; i++) {
            // I - companion^T: first column holds 1 + a[1], a[2], ...; super-diagonal -1
            system.setEntry(i, 0, (i == 0 ? 1.0 : 0.0) + a[i + 1]);
            if (i > 0) {
                system.addToEntry(i, i, 1.0);
            }
            if (i + 1 < m) {
                system.setEntry(i, i + 1, -1.0);
            }
        }
        RealVector rhs = new ArrayRealVector(m);
        for (int i = 0; i < m; i++) {
            rhs.setEntry(i, b[i + 1] - a[i + 1] * b[0]);
        }
        return new LUDecomposition(system).getSolver().solve(rhs).toArray();
    }

    private static double[] scaled(double[] v, double factor) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i] * factor;
        return out;
    }

    private static void reverse(double[] v) {
        for (int i = 0, j = v.length - 1; i < j; i++, j--) {
            double t = v[i];
            v[i] = v[j];
            v[j] = t;
        }
    }

    /** Coefficients of (z + 1)^n, highest power first. */
    private static double[] binomialCoefficients(int n) {
        double[] c = new double[n + 1];
        c[0] = 1.0;
        for (int i = 1; i <= n; i++) {
            for (int j = i; j > 0; j--) c[j] += c[j - 1];
        }
        return c;
    }

    /** Real part of the monic polynomial with the given roots, highest power first. */
    private static double[] realPolynomial(Complex[] roots) {
        Complex[] c = new Complex[roots.length + 1];
        Arrays.fill(c, Complex.ZERO);
        c[0] = Complex.ONE;
        for (int r = 0; r < roots.length; r++) {
            for (int j = r + 1; j > 0; j--) {
                c[j] = c[j].subtract(c[j - 1].multiply(roots[r]));
            }
        }
        double[] out = new double[c.length];
        for (int i = 0; i < c.length; i++) out[i] = c[i].real;
        return out;
    }
}
