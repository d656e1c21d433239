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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Scalar statistics of one ROI computed from one analysis. Only enabled statistics are present.
 */
public final class CompilationResult {

    private final String identityTag;
    private final String analysisName;
    private final String roiName;
    private final int roiNumber;
    private final Map<RoiStatistic, Double> values;
    private final double[] opd;
    private final double[] opdDepths;
    private final List<AnalysisWarning> warnings;

    public CompilationResult(String identityTag, String analysisName, String roiName, int roiNumber,
                             Map<RoiStatistic, Double> values, double[] opd, double[] opdDepths,
                             List<AnalysisWarning> warnings) {
        this.identityTag = Objects.requireNonNull(identityTag, "identityTag must not be null");
        this.analysisName = analysisName;
        this.roiName = Objects.requireNonNull(roiName, "roiName must not be null");
        this.roiNumber = roiNumber;
        EnumMap<RoiStatistic, Double> copy = new EnumMap<>(RoiStatistic.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
        this.opd = opd == null ? null : opd.clone();
        this.opdDepths = opdDepths == null ? null : opdDepths.clone();
        this.warnings = List.copyOf(warnings);
    }

    public String identityTag()  { return identityTag; }
    public String analysisName() { return analysisName; }
    public String roiName()      { return roiName; }
    public int roiNumber()       { return roiNumber; }

    public OptionalDouble value(RoiStatistic statistic) {
        Double v = values.get(statistic);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public Map<RoiStatistic, Double> values() {
        return values;
    }

    public Optional<double[]> opd() {
        return Optional.ofNullable(opd == null ? null : opd.clone());
    }

    public Optional<double[]> opdDepths() {
        return Optional.ofNullable(opdDepths == null ? null : opdDepths.clone());
    }

    public List<AnalysisWarning> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "CompilationResult(" + roiName + "#" + roiNumber + ", " + values + ", warnings=" + warnings.size() + ")";
    }
}
