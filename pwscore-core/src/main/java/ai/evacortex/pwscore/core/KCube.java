/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;

/**
 * Reflectance resampled onto a uniformly spaced, increasing wavenumber axis (radians / µm).
 */
public final class KCube extends SpectralCube {

    private static final double UNIFORMITY_TOLERANCE = 1e-6;

    public KCube(int rows, int cols, double[] data, double[] wavenumbers) {
        super(rows, cols, data, wavenumbers);
        if (axis.length < 2) {
            throw new InvalidCubeException("A k-cube needs at least two wavenumbers");
        }
        double dk = axis[1] - axis[0];
        if (!(dk > 0)) {
            throw new InvalidCubeException("Wavenumbers must be strictly increasing");
        }
        for (int i = 2; i < axis.length; i++) {
            double step = axis[i] - axis[i - 1];
            if (Math.abs(step - dk) > UNIFORMITY_TOLERANCE * Math.abs(dk) + 1e-12) {
                throw new InvalidCubeException("Wavenumbers must be uniformly spaced (index " + i + ")");
            }
        }
    }

    public double[] wavenumbers() {
        return copyAxis();
    }

    public double wavenumberStep() {
        return (axis[bands - 1] - axis[0]) / (bands - 1);
    }

    public KCube withData(double[] newData) {
        return new KCube(rows, cols, newData, axis);
    }
}
