/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

/**
 * Abscissa of the log-autocorrelation line fit.
 */
public enum AutocorrelationLagAxis {
    /** Lag index 0, 1, 2, ... */
    INDEX,
    /** Lag expressed as {@code (i * Δk)^2}, the abscissa the Ld constants were calibrated with. */
    WAVENUMBER_SQUARED;

    public double abscissa(int lag, double dk) {
        return switch (this) {
            case INDEX -> lag;
            case WAVENUMBER_SQUARED -> (lag * dk) * (lag * dk);
        };
    }
}
