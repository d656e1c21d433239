/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.compilation;

import ai.evacortex.pwscore.core.AnalysisWarning;

import java.util.Optional;

/**
 * Bounds on compiled values that indicate a questionable measurement.
 */
final class QualityChecks {

    static final double MEAN_SIGMA_RATIO_LOW = 0.3;
    static final double MEAN_SIGMA_RATIO_HIGH = 0.4;

    private QualityChecks() {}

    static Optional<AnalysisWarning> checkRSquared(double[] rSquaredInRoi, double threshold) {
        int below = 0;
        for (double v : rSquaredInRoi) {
            if (v < threshold) below++;
        }
        if (below == 0) {
            return Optional.empty();
        }
        return Optional.of(new AnalysisWarning("Low autocorrelation fit quality",
                below + " of " + rSquaredInRoi.length + " pixels have R² below " + threshold));
    }

    static Optional<AnalysisWarning> checkMeanSigmaRatio(double ratio) {
        if (Double.isNaN(ratio) || (ratio >= MEAN_SIGMA_RATIO_LOW && ratio <= MEAN_SIGMA_RATIO_HIGH)) {
            return Optional.empty();
        }
        return Optional.of(new AnalysisWarning("Mean-sigma ratio out of range",
                "Ratio " + ratio + " lies outside [" + MEAN_SIGMA_RATIO_LOW + ", " + MEAN_SIGMA_RATIO_HIGH + "]"));
    }
}
