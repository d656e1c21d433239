/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.compilation;

import ai.evacortex.pwscore.core.AnalysisResults;
import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.Roi;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.MissingStatisticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reduces per-pixel analysis maps to per-ROI values.
 *
 * <p>Every scalar statistic is the arithmetic mean of its map over the ROI mask. The
 * autocorrelation slope additionally requires {@code R² > rSquaredThreshold} and a negative slope.
 * NaN pixels inside the mask propagate into the mean. An empty selection yields NaN and a
 * warning.</p>
 */
public final class RoiCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RoiCompiler.class);

    private final CompilerSettings settings;
    private final double rSquaredThreshold;
    private final double rSquaredWarning;

    public RoiCompiler(CompilerSettings settings) {
        this(settings,
                Double.parseDouble(System.getProperty("pwscore.compile.rSquaredThreshold", "0.9")),
                Double.parseDouble(System.getProperty("pwscore.warn.rSquared", "0.7")));
    }

    public RoiCompiler(CompilerSettings settings, double rSquaredThreshold, double rSquaredWarning) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.rSquaredThreshold = rSquaredThreshold;
        this.rSquaredWarning = rSquaredWarning;
    }

    public CompilationResult compile(String analysisName, AnalysisResults results, Roi roi) {
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(roi, "roi must not be null");
        if (roi.rows() != results.rows() || roi.cols() != results.cols()) {
            throw new InvalidCubeException("ROI " + roi.name() + "#" + roi.number() + " is " + roi.rows() + "x"
                    + roi.cols() + " but the analysis maps are " + results.rows() + "x" + results.cols());
        }
        boolean[] mask = roi.mask();
        List<AnalysisWarning> warnings = new ArrayList<>();
        Map<RoiStatistic, Double> values = new EnumMap<>(RoiStatistic.class);
        double[] opd = null;
        double[] opdDepths = null;

        if (roi.area() == 0) {
            warnings.add(new AnalysisWarning("Empty ROI",
                    "ROI " + roi.name() + "#" + roi.number() + " selects no pixels; compiled values are NaN"));
        }

        for (RoiStatistic statistic : settings.enabled()) {
            switch (statistic) {
                case REFLECTANCE -> values.put(statistic, mean(results.reflectance(), mask, null));
                case RMS -> values.put(statistic, mean(results.rms(), mask, null));
                case POLYNOMIAL_RMS -> values.put(statistic, mean(require(results.polynomialRms(), statistic, results), mask, null));
                case LD -> values.put(statistic, mean(require(results.ld(), statistic, results), mask, null));
                case ROI_AREA -> values.put(statistic, (double) roi.area());
                case AUTOCORRELATION_SLOPE -> {
                    PixelMap slope = require(results.autoCorrelationSlope(), statistic, results);
                    PixelMap r2 = require(results.rSquared(), statistic, results);
                    boolean[] condition = new boolean[mask.length];
                    for (int i = 0; i < mask.length; i++) {
                        condition[i] = r2.at(i) > rSquaredThreshold && slope.at(i) < 0;
                    }
                    double v = mean(slope, mask, condition);
                    if (Double.isNaN(v) && roi.area() > 0) {
                        warnings.add(new AnalysisWarning("No reliable autocorrelation pixels",
                                "No pixel in the ROI has R² > " + rSquaredThreshold + " and a negative slope"));
                    }
                    values.put(statistic, v);
                }
                case R_SQUARED -> {
                    PixelMap r2 = require(results.rSquared(), statistic, results);
                    QualityChecks.checkRSquared(select(r2, mask), rSquaredWarning).ifPresent(warnings::add);
                    values.put(statistic, mean(r2, mask, null));
                }
                case MEAN_SIGMA_RATIO -> {
                    double ratio = meanSigmaRatio(results.detrended(), results.rms(), mask);
                    QualityChecks.checkMeanSigmaRatio(ratio).ifPresent(warnings::add);
                    values.put(statistic, ratio);
                }
                case OPD -> {
                    OpdCube cube = require(results.opd(), statistic, results);
                    opd = meanSpectrum(cube.copyData(), cube.bands(), mask);
                    opdDepths = cube.depths();
                }
            }
        }

        for (AnalysisWarning w : warnings) {
            logger.warn("{}#{}: {}", roi.name(), roi.number(), w);
        }
        return new CompilationResult(results.identityTag(), analysisName, roi.name(), roi.number(), values,
                opd, opdDepths, warnings);
    }

    static double mean(PixelMap map, boolean[] mask, boolean[] condition) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i] && (condition == null || condition[i])) {
                sum += map.at(i);
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private static double[] select(PixelMap map, boolean[] mask) {
        int n = 0;
        for (boolean b : mask) if (b) n++;
        double[] out = new double[n];
        int j = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) out[j++] = map.at(i);
        }
        return out;
    }

    private static double[] meanSpectrum(double[] data, int bands, boolean[] mask) {
        double[] out = new double[bands];
        int count = 0;
        for (int p = 0; p < mask.length; p++) {
            if (!mask[p]) continue;
            count++;
            for (int b = 0; b < bands; b++) out[b] += data[p * bands + b];
        }
        for (int b = 0; b < bands; b++) {
            out[b] = count == 0 ? Double.NaN : out[b] / count;
        }
        return out;
    }

    static double meanSigmaRatio(KCube detrended, PixelMap rms, boolean[] mask) {
        double[] spectrum = meanSpectrum(detrended.copyData(), detrended.bands(), mask);
        double m = 0.0;
        for (double v : spectrum) m += v;
        m /= spectrum.length;
        double var = 0.0;
        for (double v : spectrum) var += (v - m) * (v - m);
        var /= spectrum.length;

        double rmsSq = 0.0;
        int count = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                rmsSq += rms.at(i) * rms.at(i);
                count++;
            }
        }
        return count == 0 ? Double.NaN : var / (rmsSq / count);
    }

    private static <T> T require(Optional<T> value, RoiStatistic statistic, AnalysisResults results) {
        return value.orElseThrow(() -> new MissingStatisticException(statistic.name(), results.identityTag()));
    }
}
