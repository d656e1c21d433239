/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

/**
 * Depth-resolved spectrum magnitude per pixel. The axis holds optical path depth in µm.
 */
public final class OpdCube extends SpectralCube {

    public OpdCube(int rows, int cols, double[] data, double[] depths) {
        super(rows, cols, data, depths);
    }

    public double[] depths() {
        return copyAxis();
    }

    public double depthStep() {
        return bands > 1 ? axis[1] - axis[0] : 0.0;
    }
}
