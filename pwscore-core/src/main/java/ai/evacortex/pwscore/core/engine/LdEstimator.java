/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;

/**
 * Empirical structural length scale:
 * {@code Ld = (A2 / A1) * (n² / (2 k0²)) * (σ / -m)} with {@code k0 = 2π / λ0}.
 * Pixels with {@code m >= 0} or a NaN input yield NaN.
 */
public final class LdEstimator {

    public static final double CENTER_WAVELENGTH_UM = 0.55;
    public static final double MEDIUM_INDEX = 1.38;
    public static final double A1 = 0.008;
    public static final double A2 = 4.0;

    private LdEstimator() {}

    public static double ld(double rms, double slope) {
        if (Double.isNaN(rms) || Double.isNaN(slope) || slope >= 0) {
            return Double.NaN;
        }
        double k0 = 2.0 * Math.PI / CENTER_WAVELENGTH_UM;
        return (A2 / A1) * (MEDIUM_INDEX * MEDIUM_INDEX / (2.0 * k0 * k0)) * (rms / -slope);
    }

    public static PixelMap estimate(PixelMap rms, PixelMap slope) {
        if (!rms.sameShape(slope.rows(), slope.cols())) {
            throw new InvalidCubeException("RMS and slope maps differ in shape");
        }
        double[] out = new double[rms.rows() * rms.cols()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ld(rms.at(i), slope.at(i));
        }
        return new PixelMap(rms.rows(), rms.cols(), out);
    }
}
