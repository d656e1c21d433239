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
import ai.evacortex.pwscore.core.CubeTestUtils;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.Roi;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.MissingStatisticException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoiCompilerTest {

    private static final PixelMap GRID = PixelMap.of(new double[][]{{1, 2}, {3, 4}});

    private static final Roi TOP_LEFT = new Roi("cell", 1, 2, 2, new boolean[]{true, false, false, false});
    private static final Roi ALL = new Roi("cell", 2, 2, 2, new boolean[]{true, true, true, true});
    private static final Roi NONE = new Roi("cell", 3, 2, 2, new boolean[4]);

    private static AnalysisResults basicResults() {
        return CubeTestUtils.results("tag", GRID, GRID, null, null, null, null, null, List.of());
    }

    private static RoiCompiler compiler(RoiStatistic first, RoiStatistic... rest) {
        return new RoiCompiler(CompilerSettings.of(first, rest), 0.9, 0.7);
    }

    @Test
    void testMeanOverSinglePixel() {
        CompilationResult result = compiler(RoiStatistic.REFLECTANCE, RoiStatistic.ROI_AREA)
                .compile("a1", basicResults(), TOP_LEFT);

        assertEquals(1.0, result.value(RoiStatistic.REFLECTANCE).getAsDouble());
        assertEquals(1.0, result.value(RoiStatistic.ROI_AREA).getAsDouble());
        assertEquals("a1", result.analysisName());
        assertEquals("cell", result.roiName());
        assertEquals(1, result.roiNumber());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testFullMaskGivesPlainMean() {
        CompilationResult result = compiler(RoiStatistic.RMS).compile("a1", basicResults(), ALL);

        assertEquals(2.5, result.value(RoiStatistic.RMS).getAsDouble(), 1e-12);
        assertTrue(result.value(RoiStatistic.REFLECTANCE).isEmpty());
    }

    @Test
    void testEmptyRoiGivesNaNAndWarning() {
        CompilationResult result = compiler(RoiStatistic.REFLECTANCE, RoiStatistic.RMS)
                .compile("a1", basicResults(), NONE);

        assertTrue(Double.isNaN(result.value(RoiStatistic.REFLECTANCE).getAsDouble()));
        assertTrue(Double.isNaN(result.value(RoiStatistic.RMS).getAsDouble()));
        assertTrue(result.warnings().stream().map(AnalysisWarning::shortMessage).anyMatch("Empty ROI"::equals));
    }

    @Test
    void testNaNPixelsPropagate() {
        PixelMap withNaN = PixelMap.of(new double[][]{{1, Double.NaN}, {3, 4}});
        AnalysisResults results = CubeTestUtils.results("tag", withNaN, GRID, null, null, null, null, null, List.of());

        CompilationResult result = compiler(RoiStatistic.REFLECTANCE).compile("a1", results, ALL);

        assertTrue(Double.isNaN(result.value(RoiStatistic.REFLECTANCE).getAsDouble()));
    }

    @Test
    void testMissingStatisticThrows() {
        RoiCompiler compiler = compiler(RoiStatistic.LD);

        assertThrows(MissingStatisticException.class, () -> compiler.compile("a1", basicResults(), ALL));
    }

    @Test
    void testShapeMismatchThrows() {
        Roi wide = new Roi("wide", 1, 2, 3, new boolean[6]);

        assertThrows(InvalidCubeException.class,
                () -> compiler(RoiStatistic.RMS).compile("a1", basicResults(), wide));
    }

    @Test
    void testAutocorrelationSlopeUsesOnlyReliablePixels() {
        PixelMap slope = PixelMap.of(new double[][]{{-0.5, -0.2}, {0.1, -0.4}});
        PixelMap r2 = PixelMap.of(new double[][]{{0.95, 0.5}, {0.99, 0.92}});
        AnalysisResults results = CubeTestUtils.results("tag", GRID, GRID, GRID, slope, r2, GRID, null, List.of());

        CompilationResult result = compiler(RoiStatistic.AUTOCORRELATION_SLOPE, RoiStatistic.R_SQUARED)
                .compile("a1", results, ALL);

        assertEquals(-0.45, result.value(RoiStatistic.AUTOCORRELATION_SLOPE).getAsDouble(), 1e-12);
        assertEquals((0.95 + 0.5 + 0.99 + 0.92) / 4, result.value(RoiStatistic.R_SQUARED).getAsDouble(), 1e-12);
        assertTrue(result.warnings().stream().map(AnalysisWarning::shortMessage)
                .anyMatch("Low autocorrelation fit quality"::equals));
    }

    @Test
    void testNoReliableAutocorrelationPixels() {
        PixelMap slope = PixelMap.of(new double[][]{{0.5, 0.2}, {0.1, 0.4}});
        PixelMap r2 = CubeTestUtils.filledMap(2, 2, 0.99);
        AnalysisResults results = CubeTestUtils.results("tag", GRID, GRID, GRID, slope, r2, GRID, null, List.of());

        CompilationResult result = compiler(RoiStatistic.AUTOCORRELATION_SLOPE).compile("a1", results, ALL);

        assertTrue(Double.isNaN(result.value(RoiStatistic.AUTOCORRELATION_SLOPE).getAsDouble()));
        assertEquals(1, result.warnings().size());
    }

    @Test
    void testMeanSigmaRatioOutOfRangeWarns() {
        PixelMap rms = CubeTestUtils.filledMap(2, 2, Math.sqrt(0.000525));
        AnalysisResults results = CubeTestUtils.results("tag", GRID, rms, null, null, null, null, null, List.of());

        CompilationResult result = compiler(RoiStatistic.MEAN_SIGMA_RATIO).compile("a1", results, ALL);

        assertEquals(1.0, result.value(RoiStatistic.MEAN_SIGMA_RATIO).getAsDouble(), 1e-9);
        assertTrue(result.warnings().stream().map(AnalysisWarning::shortMessage)
                .anyMatch("Mean-sigma ratio out of range"::equals));
    }

    @Test
    void testOpdMeanSpectrum() {
        double[] data = new double[2 * 2 * 3];
        for (int p = 0; p < 4; p++) {
            for (int b = 0; b < 3; b++) data[p * 3 + b] = p * 10 + b;
        }
        OpdCube opd = new OpdCube(2, 2, data, new double[]{0.0, 0.5, 1.0});
        AnalysisResults results = CubeTestUtils.results("tag", GRID, GRID, GRID, GRID, GRID, GRID, opd, List.of());
        Roi topRow = new Roi("row", 1, 2, 2, new boolean[]{true, true, false, false});

        CompilationResult result = compiler(RoiStatistic.OPD).compile("a1", results, topRow);

        assertArrayEquals(new double[]{5, 6, 7}, result.opd().orElseThrow(), 1e-12);
        assertArrayEquals(new double[]{0.0, 0.5, 1.0}, result.opdDepths().orElseThrow(), 1e-12);
        assertFalse(result.values().containsKey(RoiStatistic.OPD));
    }

    @Test
    void testCompilerSettings() {
        CompilerSettings all = CompilerSettings.all();
        for (RoiStatistic s : RoiStatistic.values()) assertTrue(all.isEnabled(s));
        assertFalse(CompilerSettings.of(RoiStatistic.RMS).isEnabled(RoiStatistic.LD));
        assertFalse(RoiStatistic.OPD.isScalar());
    }
}
