/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Least-squares polynomial background removal in k-space.
 *
 * <p>The design matrix is built on the centred and scaled wavenumber axis, so it depends on the axis
 * only. Its hat matrix {@code H = Q Q^T} (thin QR) is computed once and every pixel's fit is
 * {@code H y}. Order 0 is a plain mean, exact for spectra that are already constant.</p>
 */
public final class PolynomialDetrender {

    private final int order;

    public record Result(KCube detrended, KCube polynomial) {}

    public PolynomialDetrender(int order) {
        if (order < 0) {
            throw new InvalidSettingsException("polynomialOrder must be >= 0, got " + order);
        }
        this.order = order;
    }

    public Result detrend(KCube cube) {
        int n = cube.bands();
        if (order + 1 > n) {
            throw new InvalidSettingsException("polynomialOrder " + order + " needs at least " + (order + 1)
                    + " wavenumbers, got " + n);
        }
        double[] data = cube.copyData();
        double[] fit = new double[data.length];
        int pixels = cube.pixelCount();

        if (order == 0) {
            for (int p = 0; p < pixels; p++) {
                int base = p * n;
                // mean taken about the first sample, exact for constant spectra
                double x0 = data[base];
                double shift = 0.0;
                for (int i = 0; i < n; i++) shift += data[base + i] - x0;
                double mean = x0 + shift / n;
                for (int i = 0; i < n; i++) {
                    fit[base + i] = mean;
                    data[base + i] -= mean;
                }
            }
            return new Result(cube.withData(data), cube.withData(fit));
        }

        double[][] hat = hatMatrix(cube.wavenumbers(), order);
        for (int p = 0; p < pixels; p++) {
            int base = p * n;
            for (int i = 0; i < n; i++) {
                double v = 0.0;
                double[] row = hat[i];
                for (int j = 0; j < n; j++) v += row[j] * data[base + j];
                fit[base + i] = v;
            }
            for (int i = 0; i < n; i++) data[base + i] -= fit[base + i];
        }
        return new Result(cube.withData(data), cube.withData(fit));
    }

    static double[][] hatMatrix(double[] k, int order) {
        int n = k.length;
        double mean = 0.0;
        for (double v : k) mean += v;
        mean /= n;
        double scale = 0.0;
        for (double v : k) scale = Math.max(scale, Math.abs(v - mean));
        if (scale == 0.0) scale = 1.0;

        RealMatrix design = new Array2DRowRealMatrix(n, order + 1);
        for (int i = 0; i < n; i++) {
            double x = (k[i] - mean) / scale;
            double pow = 1.0;
            for (int d = 0; d <= order; d++) {
                design.setEntry(i, d, pow);
                pow *= x;
            }
        }
        RealMatrix q = new QRDecomposition(design).getQ().getSubMatrix(0, n - 1, 0, order);
        return q.multiply(q.transpose()).getData();
    }
}
