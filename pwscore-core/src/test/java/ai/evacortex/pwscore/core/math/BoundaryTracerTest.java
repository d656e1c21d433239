/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryTracerTest {

    @Test
    void testRectangleOutlineVisitsOnlyBorderPixels() {
        int rows = 6, cols = 7;
        boolean[] mask = new boolean[rows * cols];
        for (int r = 1; r <= 4; r++) {
            for (int c = 2; c <= 5; c++) mask[r * cols + c] = true;
        }

        double[][] outline = BoundaryTracer.trace(mask, rows, cols);

        assertEquals(12, outline.length, "4x4 block has 12 border pixels");
        for (double[] v : outline) {
            int c = (int) v[0];
            int r = (int) v[1];
            assertTrue(mask[r * cols + c]);
            assertTrue(r == 1 || r == 4 || c == 2 || c == 5, "vertex must lie on the border");
        }
        assertArrayEquals(new double[]{2, 1}, outline[0]);
    }

    @Test
    void testEmptyMaskHasNoOutline() {
        assertEquals(0, BoundaryTracer.trace(new boolean[9], 3, 3).length);
    }

    @Test
    void testSinglePixel() {
        boolean[] mask = new boolean[9];
        mask[4] = true;

        double[][] outline = BoundaryTracer.trace(mask, 3, 3);

        assertEquals(1, outline.length);
        assertArrayEquals(new double[]{1, 1}, outline[0]);
    }
}
