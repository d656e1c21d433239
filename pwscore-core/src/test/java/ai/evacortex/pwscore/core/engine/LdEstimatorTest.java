/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.PixelMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LdEstimatorTest {

    @Test
    void testNaNWhereSlopeIsNotNegative() {
        PixelMap rms = PixelMap.of(new double[][]{{0.1, 0.1, 0.1, 0.1}});
        PixelMap slope = PixelMap.of(new double[][]{{0.0, 0.2, Double.NaN, -0.2}});

        PixelMap ld = LdEstimator.estimate(rms, slope);

        assertTrue(Double.isNaN(ld.get(0, 0)));
        assertTrue(Double.isNaN(ld.get(0, 1)));
        assertTrue(Double.isNaN(ld.get(0, 2)));
        assertTrue(ld.get(0, 3) > 0);
    }

    @Test
    void testFormula() {
        double k0 = 2 * Math.PI / 0.55;
        double expected = (4.0 / 0.008) * (1.38 * 1.38 / (2 * k0 * k0)) * (0.05 / 0.5);

        assertEquals(expected, LdEstimator.ld(0.05, -0.5), 1e-15);
    }

    @Test
    void testLdScalesLinearlyWithRms() {
        assertEquals(2 * LdEstimator.ld(0.1, -0.3), LdEstimator.ld(0.2, -0.3), 1e-15);
    }
}
