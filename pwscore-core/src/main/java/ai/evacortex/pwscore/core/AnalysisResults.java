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

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything derived from one (sample, reference, settings) triple. Created once by the analysis
 * pipeline or by a results codec and never modified.
 *
 * <p>Reflectance, RMS and the detrended k-cube are always present. The remaining maps are absent
 * when the run skipped the advanced statistics.</p>
 */
public final class AnalysisResults {

    private final String identityTag;
    private final String sampleTag;
    private final String referenceTag;
    private final AnalysisSettings settings;
    private final Instant created;

    private final PixelMap reflectance;
    private final PixelMap rms;
    private final PixelMap polynomialRms;
    private final PixelMap autoCorrelationSlope;
    private final PixelMap rSquared;
    private final PixelMap ld;
    private final OpdCube opd;
    private final KCube detrended;

    private final List<AnalysisWarning> warnings;

    public AnalysisResults(String identityTag, String sampleTag, String referenceTag, AnalysisSettings settings,
                           Instant created, PixelMap reflectance, PixelMap rms, PixelMap polynomialRms,
                           PixelMap autoCorrelationSlope, PixelMap rSquared, PixelMap ld, OpdCube opd,
                           KCube detrended, List<AnalysisWarning> warnings) {
        this.identityTag = Objects.requireNonNull(identityTag, "identityTag must not be null");
        this.sampleTag = Objects.requireNonNull(sampleTag, "sampleTag must not be null");
        this.referenceTag = Objects.requireNonNull(referenceTag, "referenceTag must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.created = Objects.requireNonNull(created, "created must not be null");
        this.reflectance = Objects.requireNonNull(reflectance, "reflectance must not be null");
        this.rms = Objects.requireNonNull(rms, "rms must not be null");
        this.detrended = Objects.requireNonNull(detrended, "detrended must not be null");
        this.polynomialRms = polynomialRms;
        this.autoCorrelationSlope = autoCorrelationSlope;
        this.rSquared = rSquared;
        this.ld = ld;
        this.opd = opd;
        this.warnings = List.copyOf(warnings == null ? List.of() : warnings);

        int r = reflectance.rows();
        int c = reflectance.cols();
        for (PixelMap m : new PixelMap[]{rms, polynomialRms, autoCorrelationSlope, rSquared, ld}) {
            if (m != null && !m.sameShape(r, c)) {
                throw new InvalidCubeException("Result maps must share the shape " + r + "x" + c);
            }
        }
        if (opd != null && (opd.rows() != r || opd.cols() != c)) {
            throw new InvalidCubeException("OPD cube must share the shape " + r + "x" + c);
        }
        if (detrended.rows() != r || detrended.cols() != c) {
            throw new InvalidCubeException("Detrended k-cube must share the shape " + r + "x" + c);
        }
    }

    public String identityTag()         { return identityTag; }
    public String sampleTag()           { return sampleTag; }
    public String referenceTag()        { return referenceTag; }
    public AnalysisSettings settings()  { return settings; }
    public Instant created()            { return created; }
    public int rows()                   { return reflectance.rows(); }
    public int cols()                   { return reflectance.cols(); }

    public PixelMap reflectance()       { return reflectance; }
    public PixelMap rms()               { return rms; }
    public KCube detrended()            { return detrended; }

    public Optional<PixelMap> polynomialRms()        { return Optional.ofNullable(polynomialRms); }
    public Optional<PixelMap> autoCorrelationSlope() { return Optional.ofNullable(autoCorrelationSlope); }
    public Optional<PixelMap> rSquared()             { return Optional.ofNullable(rSquared); }
    public Optional<PixelMap> ld()                   { return Optional.ofNullable(ld); }
    public Optional<OpdCube> opd()                   { return Optional.ofNullable(opd); }

    public List<AnalysisWarning> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "AnalysisResults(" + identityTag + ", " + rows() + "x" + cols()
                + (opd == null ? "" : ", opd=" + opd.bands()) + ", warnings=" + warnings.size() + ")";
    }
}
