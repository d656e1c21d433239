/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.AnalysisSettings;

/**
 * Options controlling {@link StatisticsExtractor}.
 *
 * <p>{@code autoCorrStartIndex} is the first lag entering the log-linear fit. The default 0 includes
 * the zero lag, which the Ld constants were calibrated against; it makes uncorrelated spectra fit
 * a strongly negative slope. Starting at lag 1 leaves such spectra with a slope near zero.</p>
 */
public record ExtractionOptions(
        int autoCorrStopIndex,             // lags used in the log-linear fit end here, exclusive
        boolean autoCorrMinSub,            // subtract the cube-wide minimum of the autocorrelation first
        boolean useHannWindow,             // window the spectrum before the OPD transform
        int opdStopIndex,                  // depth bins retained
        AutocorrelationLagAxis lagAxis,    // abscissa of the fit
        int autoCorrStartIndex             // first lag used in the log-linear fit
) {
    public ExtractionOptions(int autoCorrStopIndex, boolean autoCorrMinSub, boolean useHannWindow, int opdStopIndex,
                             AutocorrelationLagAxis lagAxis) {
        this(autoCorrStopIndex, autoCorrMinSub, useHannWindow, opdStopIndex, lagAxis, 0);
    }

    public static ExtractionOptions from(AnalysisSettings settings) {
        return new ExtractionOptions(settings.autoCorrStopIndex(), settings.autoCorrMinSub(),
                settings.useHannWindow(), settings.opdStopIndex(), AutocorrelationLagAxis.INDEX);
    }

    public ExtractionOptions withLagAxis(AutocorrelationLagAxis axis) {
        return new ExtractionOptions(autoCorrStopIndex, autoCorrMinSub, useHannWindow, opdStopIndex, axis,
                autoCorrStartIndex);
    }

    public ExtractionOptions withFitStartIndex(int start) {
        return new ExtractionOptions(autoCorrStopIndex, autoCorrMinSub, useHannWindow, opdStopIndex, lagAxis, start);
    }
}
