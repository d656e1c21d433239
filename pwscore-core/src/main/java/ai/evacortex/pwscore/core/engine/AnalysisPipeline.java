/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.AnalysisResults;
import ai.evacortex.pwscore.core.AnalysisSettings;
import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import ai.evacortex.pwscore.core.reference.ReferenceDataService;
import ai.evacortex.pwscore.core.storage.HashingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the full analysis of one sample cube:
 * normalization, spectral filtering, window selection, k-space conversion, polynomial detrending,
 * statistics extraction and Ld estimation.
 *
 * <p>The pipeline holds no per-run state; one instance may serve many threads.</p>
 */
public final class AnalysisPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final NormalizationStage normalization;
    private final KSpaceConverter kSpaceConverter = new KSpaceConverter();
    private final AutocorrelationLagAxis lagAxis;

    public AnalysisPipeline(ReferenceDataService referenceData) {
        this(referenceData, AutocorrelationLagAxis.INDEX);
    }

    public AnalysisPipeline(ReferenceDataService referenceData, AutocorrelationLagAxis lagAxis) {
        this.normalization = new NormalizationStage(referenceData);
        this.lagAxis = Objects.requireNonNull(lagAxis, "lagAxis must not be null");
    }

    public AnalysisResults run(ImageCube sample, ImageCube reference, AnalysisSettings settings) {
        return run(sample, reference, null, settings);
    }

    /**
     * @param strayReflectance stray reflectance cube, or {@code null} to skip the correction
     */
    public AnalysisResults run(ImageCube sample, ImageCube reference, ImageCube strayReflectance,
                               AnalysisSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        checkStrayReflectance(strayReflectance, settings);
        String sampleTag = HashingUtil.computeCubeHash(sample);
        String referenceTag = HashingUtil.computeCubeHash(reference);
        String strayTag = strayReflectance == null ? null : HashingUtil.computeCubeHash(strayReflectance);
        String identityTag = HashingUtil.computeIdentityTag(sampleTag, referenceTag, strayTag, settings);
        logger.info("Analysis {} started for {}", identityTag, sample);

        List<AnalysisWarning> warnings = new ArrayList<>();
        NormalizationStage.Result normalized = normalization.normalize(
                sample, reference, strayReflectance, settings.referenceMaterial(), settings.relativeUnits());
        warnings.addAll(normalized.warnings());

        SpectralFilter filter = new SpectralFilter(settings.filterOrder(), settings.filterCutoff(),
                settings.filterCutoffMode());
        ImageCube windowed = filter.apply(normalized.cube())
                .selectWavelengths(settings.wavelengthStart(), settings.wavelengthStop());
        PixelMap reflectance = windowed.meanOverSpectrum();

        KCube kCube = kSpaceConverter.convert(windowed);
        PolynomialDetrender.Result detrended = new PolynomialDetrender(settings.polynomialOrder()).detrend(kCube);

        StatisticsExtractor extractor = new StatisticsExtractor(ExtractionOptions.from(settings).withLagAxis(lagAxis));
        PixelMap rms = extractor.rms(detrended.detrended());

        PixelMap polynomialRms = null;
        PixelMap slope = null;
        PixelMap rSquared = null;
        PixelMap ld = null;
        OpdCube opd = null;
        if (!settings.skipAdvanced()) {
            polynomialRms = extractor.polynomialRms(detrended.polynomial());
            StatisticsExtractor.AutocorrelationFit fit = extractor.autocorrelation(detrended.detrended());
            slope = fit.slope();
            rSquared = fit.rSquared();
            warnings.addAll(fit.warnings());
            ld = LdEstimator.estimate(rms, slope);
            opd = extractor.opd(detrended.detrended());
        }

        AnalysisResults results = new AnalysisResults(identityTag, sampleTag, referenceTag, settings, Instant.now(),
                reflectance, rms, polynomialRms, slope, rSquared, ld, opd, detrended.detrended(), warnings);
        logger.info("Analysis {} finished with {} warning(s)", identityTag, warnings.size());
        return results;
    }

    /**
     * A stray-reflectance cube is applied exactly when the settings name one.
     *
     * @throws InvalidSettingsException when the cube and {@code extraReflectanceId} disagree
     */
    public static void checkStrayReflectance(ImageCube strayReflectance, AnalysisSettings settings) {
        if (strayReflectance != null && settings.extraReflectanceId() == null) {
            throw new InvalidSettingsException("A stray reflectance cube was supplied but extraReflectanceId is not set");
        }
        if (strayReflectance == null && settings.extraReflectanceId() != null) {
            throw new InvalidSettingsException("extraReflectanceId '" + settings.extraReflectanceId()
                    + "' is set but no stray reflectance cube was supplied");
        }
    }
}
