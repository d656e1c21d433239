/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.compilation;

/**
 * Statistics an {@link RoiCompiler} can reduce over a region.
 */
public enum RoiStatistic {
    REFLECTANCE,
    RMS,
    POLYNOMIAL_RMS,
    /** Averaged only over pixels with a good fit and a negative slope. */
    AUTOCORRELATION_SLOPE,
    R_SQUARED,
    LD,
    /** Variance of the region's mean k-spectrum over the mean per-pixel RMS². */
    MEAN_SIGMA_RATIO,
    /** Number of pixels in the region. */
    ROI_AREA,
    /** Mean OPD spectrum; reported as a spectrum rather than a scalar. */
    OPD;

    public boolean isScalar() {
        return this != OPD;
    }
}
