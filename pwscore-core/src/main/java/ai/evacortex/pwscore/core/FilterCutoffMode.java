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
 * How {@link AnalysisSettings#filterCutoff()} is turned into the normalized digital cutoff.
 */
public enum FilterCutoffMode {
    /** The cutoff already is the fraction of Nyquist, regardless of the cube's wavelength spacing. */
    NOMINAL,
    /** The cutoff is in cycles per nanometre and is normalized by the measured wavelength spacing. */
    MEASURED;

    /**
     * @param cutoff              configured cutoff
     * @param wavelengthStepNm    measured spacing of the wavelength axis
     * @return cutoff as a fraction of the Nyquist frequency
     */
    public double normalizedCutoff(double cutoff, double wavelengthStepNm) {
        return switch (this) {
            case NOMINAL -> cutoff;
            case MEASURED -> 2.0 * cutoff * wavelengthStepNm;
        };
    }
}
