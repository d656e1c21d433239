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
import ai.evacortex.pwscore.core.CubeMetadata;
import ai.evacortex.pwscore.core.CubeTestUtils;
import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.Material;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import ai.evacortex.pwscore.core.math.Complex;
import ai.evacortex.pwscore.core.reference.ReferenceDataService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationStageTest {

    private static final double THEORY_R = 0.04;

    /** Reference data whose reflectance is a fixed constant. */
    private static final ReferenceDataService FIXED = new ReferenceDataService() {
        @Override
        public Complex[] refractiveIndex(Material material, double[] wavelengthsNm) {
            Complex[] out = new Complex[wavelengthsNm.length];
            java.util.Arrays.fill(out, Complex.ONE);
            return out;
        }

        @Override
        public double[] reflectance(Material first, Material second, double[] wavelengthsNm) {
            double[] r = new double[wavelengthsNm.length];
            java.util.Arrays.fill(r, THEORY_R);
            return r;
        }

        @Override
        public double[] supportedRange() {
            return new double[]{0, Double.MAX_VALUE};
        }
    };

    private final double[] wv = CubeTestUtils.wavelengths(500, 520, 10);

    @Test
    void testDarkCountsAndExposureWithoutMaterial() {
        ImageCube sample = CubeTestUtils.constantCube(2, 2, wv, 110.0, CubeTestUtils.metadata(50.0, 10.0));
        ImageCube reference = CubeTestUtils.constantCube(2, 2, wv, 410.0, CubeTestUtils.metadata(100.0, 10.0));

        NormalizationStage.Result result = new NormalizationStage(FIXED).normalize(sample, reference, null, null);

        // (110-10)/50 = 2, (410-10)/100 = 4
        for (double v : result.cube().copyData()) assertEquals(0.5, v, 1e-12);
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().stream().map(AnalysisWarning::shortMessage)
                .anyMatch(s -> s.contains("reference material")));
    }

    @Test
    void testReferenceMaterialScalesToPhysicalReflectance() {
        ImageCube sample = CubeTestUtils.constantCube(1, 1, wv, 2.0, CubeTestUtils.metadata(1.0, 0.0));
        ImageCube reference = CubeTestUtils.constantCube(1, 1, wv, 4.0, CubeTestUtils.metadata(1.0, 0.0));

        NormalizationStage.Result result = new NormalizationStage(FIXED).normalize(sample, reference, null, Material.WATER);

        for (double v : result.cube().copyData()) assertEquals(0.5 * THEORY_R, v, 1e-12);
        assertEquals(1, result.warnings().size());
    }

    @Test
    void testRelativeUnitsKeepsReferenceUnscaled() {
        ImageCube sample = CubeTestUtils.constantCube(1, 1, wv, 2.0, CubeTestUtils.metadata(1.0, 0.0));
        ImageCube reference = CubeTestUtils.constantCube(1, 1, wv, 4.0, CubeTestUtils.metadata(1.0, 0.0));

        NormalizationStage.Result result = new NormalizationStage(FIXED)
                .normalize(sample, reference, null, Material.WATER, true);

        for (double v : result.cube().copyData()) assertEquals(0.5, v, 1e-12);
        assertTrue(result.warnings().stream().map(AnalysisWarning::shortMessage)
                .anyMatch("Relative units"::equals));
    }

    @Test
    void testStrayReflectanceSubtraction() {
        CubeMetadata md = CubeTestUtils.metadata(1.0, 0.0);
        ImageCube sample = CubeTestUtils.constantCube(1, 1, wv, 3.0, md);
        ImageCube reference = CubeTestUtils.constantCube(1, 1, wv, 6.0, md);
        ImageCube stray = CubeTestUtils.constantCube(1, 1, wv, 0.02, md);

        NormalizationStage.Result result = new NormalizationStage(FIXED).normalize(sample, reference, stray, Material.WATER);

        double i0 = 6.0 / (THEORY_R + 0.02);
        double strayCounts = 0.02 * i0;
        double expected = (3.0 - strayCounts) / ((6.0 - strayCounts) / THEORY_R);
        for (double v : result.cube().copyData()) assertEquals(expected, v, 1e-12);
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testStrayCorrectionRequiresMaterial() {
        CubeMetadata md = CubeTestUtils.metadata(1.0, 0.0);
        ImageCube cube = CubeTestUtils.constantCube(1, 1, wv, 1.0, md);

        assertThrows(InvalidSettingsException.class,
                () -> new NormalizationStage(FIXED).normalize(cube, cube, cube, null));
    }

    @Test
    void testShapeMismatchFails() {
        CubeMetadata md = CubeTestUtils.metadata(1.0, 0.0);
        ImageCube a = CubeTestUtils.constantCube(2, 2, wv, 1.0, md);
        ImageCube b = CubeTestUtils.constantCube(2, 3, wv, 1.0, md);

        assertThrows(InvalidCubeException.class, () -> new NormalizationStage(FIXED).normalize(a, b, null, null));
    }

    @Test
    void testNonPositiveReferencePropagatesAsNonFinite() {
        CubeMetadata md = CubeTestUtils.metadata(1.0, 0.0);
        ImageCube sample = CubeTestUtils.constantCube(1, 2, wv, 1.0, md);
        ImageCube reference = CubeTestUtils.cube(1, 2, wv, md, (r, c, b, w) -> c == 0 ? 0.0 : 2.0);

        ImageCube out = new NormalizationStage(FIXED).normalize(sample, reference, null, null).cube();

        assertTrue(Double.isInfinite(out.get(0, 0, 0)));
        assertEquals(0.5, out.get(0, 1, 0), 1e-12);
    }
}
