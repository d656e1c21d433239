/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.math.Fourier;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-pixel statistics of a detrended k-space cube.
 *
 * <ul>
 *     <li>RMS: population standard deviation of the detrended spectrum.</li>
 *     <li>Polynomial RMS: population standard deviation of the fitted background.</li>
 *     <li>Autocorrelation slope and R²: line fitted to {@code ln C(i)} for the first
 *         {@code autoCorrStopIndex} lags, where {@code C} is the autocorrelation normalized to
 *         {@code C(0) = 1}. Non-positive values are left out of the fit.</li>
 *     <li>OPD: one-sided FFT magnitude of the (optionally Hann windowed) spectrum, zero padded to
 *         {@code 2 * nextPow2(2N - 1)} points. Bin {@code i} lies at depth
 *         {@code i * 2π / (fftSize * Δk)} µm.</li>
 * </ul>
 */
public final class StatisticsExtractor {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsExtractor.class);

    private final ExtractionOptions options;

    /** Slope and R² maps of the autocorrelation fit. */
    public record AutocorrelationFit(PixelMap slope, PixelMap rSquared, List<AnalysisWarning> warnings) {
        public AutocorrelationFit {
            warnings = List.copyOf(warnings);
        }
    }

    /** Result of fitting a single pixel: {@code used} is the number of points that entered the fit. */
    public record LineFit(double slope, double rSquared, int used) {}

    public StatisticsExtractor(ExtractionOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        if (options.autoCorrStopIndex() < 2) {
            throw new IllegalArgumentException("autoCorrStopIndex must be >= 2");
        }
        if (options.autoCorrStartIndex() < 0 || options.autoCorrStartIndex() > options.autoCorrStopIndex() - 2) {
            throw new IllegalArgumentException("autoCorrStartIndex must lie in [0, autoCorrStopIndex - 2], got "
                    + options.autoCorrStartIndex());
        }
        if (options.opdStopIndex() < 1) {
            throw new IllegalArgumentException("opdStopIndex must be >= 1");
        }
    }

    public ExtractionOptions options() {
        return options;
    }

    public PixelMap rms(KCube detrended) {
        return detrended.stdOverSpectrum();
    }

    public PixelMap polynomialRms(KCube polynomial) {
        return polynomial.stdOverSpectrum();
    }

    public AutocorrelationFit autocorrelation(KCube detrended) {
        int n = detrended.bands();
        int pixels = detrended.pixelCount();
        double dk = detrended.wavenumberStep();

        double[][] acf = new double[pixels][];
        double min = Double.POSITIVE_INFINITY;
        for (int p = 0; p < pixels; p++) {
            acf[p] = Fourier.normalizedAutocorrelation(detrended.spectrum(p / detrended.cols(), p % detrended.cols()));
            if (options.autoCorrMinSub()) {
                for (double v : acf[p]) if (v < min) min = v;
            }
        }
        if (options.autoCorrMinSub() && Double.isFinite(min)) {
            for (double[] a : acf) {
                for (int i = 0; i < a.length; i++) a[i] -= min;
            }
        }

        int start = options.autoCorrStartIndex();
        int stop = Math.min(options.autoCorrStopIndex(), n);
        int expected = Math.max(0, stop - start);
        double[] slope = new double[pixels];
        double[] r2 = new double[pixels];
        int affectedPixels = 0;
        long excludedPoints = 0;
        for (int p = 0; p < pixels; p++) {
            LineFit fit = fitLogAutocorrelation(acf[p], start, stop, options.lagAxis(), dk);
            slope[p] = fit.slope();
            r2[p] = fit.rSquared();
            if (fit.used() < expected) {
                affectedPixels++;
                excludedPoints += expected - fit.used();
            }
        }

        List<AnalysisWarning> warnings = new ArrayList<>();
        if (affectedPixels > 0) {
            AnalysisWarning w = new AnalysisWarning("Autocorrelation points excluded",
                    excludedPoints + " non-positive autocorrelation values were left out of the log fit in "
                            + affectedPixels + " of " + pixels + " pixels");
            logger.warn("{}", w);
            warnings.add(w);
        }
        int rows = detrended.rows();
        int cols = detrended.cols();
        return new AutocorrelationFit(new PixelMap(rows, cols, slope), new PixelMap(rows, cols, r2), warnings);
    }

    /**
     * Fits {@code ln acf[i]} against the lag abscissa for {@code start <= i < stop}, skipping non-positive
     * and non-finite values. Fewer than two usable points give NaN slope and R².
     */
    public static LineFit fitLogAutocorrelation(double[] acf, int start, int stop, AutocorrelationLagAxis axis,
                                                double dk) {
        SimpleRegression regression = new SimpleRegression(true);
        int used = 0;
        int limit = Math.min(stop, acf.length);
        for (int i = start; i < limit; i++) {
            double v = acf[i];
            if (v > 0 && Double.isFinite(v)) {
                regression.addData(axis.abscissa(i, dk), Math.log(v));
                used++;
            }
        }
        if (used < 2) {
            return new LineFit(Double.NaN, Double.NaN, used);
        }
        return new LineFit(regression.getSlope(), regression.getRSquare(), used);
    }

    public OpdCube opd(KCube detrended) {
        int n = detrended.bands();
        int fftSize = 2 * Fourier.nextPowerOfTwo(2 * n - 1);
        int keep = Math.min(options.opdStopIndex(), fftSize / 2 + 1);

        double[] window = options.useHannWindow() ? Fourier.hann(n) : null;
        double norm = 1.0;
        if (window != null) {
            double energy = 0.0;
            for (double w : window) energy += w * w;
            norm = energy > 0 ? Math.sqrt(n / energy) : 1.0;
        }
        logger.debug("OPD fftSize={} bins={} hann={}", fftSize, keep, window != null);

        int pixels = detrended.pixelCount();
        double[] out = new double[pixels * keep];
        for (int p = 0; p < pixels; p++) {
            double[] spectrum = detrended.spectrum(p / detrended.cols(), p % detrended.cols());
            if (window != null) {
                for (int i = 0; i < n; i++) spectrum[i] *= window[i];
            }
            double[] mag = Fourier.oneSidedMagnitude(spectrum, fftSize);
            for (int i = 0; i < keep; i++) {
                out[p * keep + i] = mag[i] * norm;
            }
        }
        return new OpdCube(detrended.rows(), detrended.cols(), out, depthAxis(detrended.wavenumberStep(), fftSize, keep));
    }

    public static double[] depthAxis(double dk, int fftSize, int bins) {
        double[] depths = new double[bins];
        double step = 2.0 * Math.PI / (fftSize * dk);
        for (int i = 0; i < bins; i++) depths[i] = i * step;
        return depths;
    }
}
