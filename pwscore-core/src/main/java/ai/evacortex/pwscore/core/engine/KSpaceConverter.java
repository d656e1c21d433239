/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples a wavelength-indexed cube onto a uniform wavenumber axis.
 *
 * <p>{@code k = 2π / λ} with λ in µm, so wavenumbers are in radians per µm. The source axis is
 * reversed to increasing k and every pixel is linearly interpolated onto {@code N} evenly spaced
 * values between the smallest and largest k, where {@code N} is the number of source bands.
 * Interpolation weights are computed once per axis.</p>
 */
public final class KSpaceConverter {

    private static final Logger logger = LoggerFactory.getLogger(KSpaceConverter.class);

    public static double wavenumber(double wavelengthNm) {
        return 2.0 * Math.PI / (wavelengthNm * 1e-3);
    }

    /**
     * Restricts {@code cube} to {@code [start, stop]} nm (nearest bands, inclusive) and converts.
     */
    public KCube convert(ImageCube cube, double start, double stop) {
        return convert(cube.selectWavelengths(start, stop));
    }

    public KCube convert(ImageCube cube) {
        int n = cube.bands();
        if (n < 2) {
            throw new InvalidCubeException("At least two wavelengths are required for k-space conversion");
        }
        double[] sourceK = new double[n];
        for (int i = 0; i < n; i++) {
            sourceK[i] = wavenumber(cube.axisValue(n - 1 - i));
        }

        double kMin = sourceK[0];
        double kMax = sourceK[n - 1];
        double[] uniform = new double[n];
        int[] lower = new int[n];
        double[] weight = new double[n];
        int j = 0;
        for (int i = 0; i < n; i++) {
            double k = i == n - 1 ? kMax : kMin + (kMax - kMin) * i / (n - 1);
            uniform[i] = k;
            while (j < n - 2 && sourceK[j + 1] < k) j++;
            double span = sourceK[j + 1] - sourceK[j];
            lower[i] = j;
            weight[i] = Math.min(1.0, Math.max(0.0, (k - sourceK[j]) / span));
        }
        logger.debug("k-space {} .. {} rad/µm over {} points", kMin, kMax, n);

        double[] src = cube.copyData();
        double[] out = new double[src.length];
        for (int p = 0; p < cube.pixelCount(); p++) {
            int base = p * n;
            for (int i = 0; i < n; i++) {
                // source band order is reversed relative to k
                double lo = src[base + (n - 1 - lower[i])];
                double hi = src[base + (n - 2 - lower[i])];
                out[base + i] = lo + weight[i] * (hi - lo);
            }
        }
        return new KCube(cube.rows(), cube.cols(), out, uniform);
    }
}
