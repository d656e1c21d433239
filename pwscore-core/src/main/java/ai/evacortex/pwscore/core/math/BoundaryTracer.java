/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.math;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts a polygon outline from a boolean mask by Moore-neighbour tracing of the first
 * foreground component encountered in row-major order. Vertices are pixel centres given as
 * {@code {x, y}} = {@code {column, row}}.
 */
public final class BoundaryTracer {

    // clockwise starting west, in (dRow, dCol)
    private static final int[][] NEIGHBOURS = {
            {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}, {0, 1}, {1, 1}, {1, 0}, {1, -1}
    };

    private BoundaryTracer() {}

    public static double[][] trace(boolean[] mask, int rows, int cols) {
        int start = -1;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return new double[0][];
        }
        int sr = start / cols;
        int sc = start % cols;

        List<double[]> vertices = new ArrayList<>();
        vertices.add(new double[]{sc, sr});

        int r = sr;
        int c = sc;
        // we entered the start pixel from the west, where nothing is set
        int backtrack = 0;
        int maxSteps = 4 * mask.length + 4;
        for (int step = 0; step < maxSteps; step++) {
            int found = -1;
            for (int k = 1; k <= 8; k++) {
                int d = (backtrack + k) % 8;
                int nr = r + NEIGHBOURS[d][0];
                int nc = c + NEIGHBOURS[d][1];
                if (nr >= 0 && nr < rows && nc >= 0 && nc < cols && mask[nr * cols + nc]) {
                    found = d;
                    break;
                }
            }
            if (found < 0) {
                break; // isolated pixel
            }
            r += NEIGHBOURS[found][0];
            c += NEIGHBOURS[found][1];
            if (r == sr && c == sc) {
                break;
            }
            vertices.add(new double[]{c, r});
            // next search starts from the neighbour preceding the direction we came from
            backtrack = (found + 5) % 8;
        }
        return vertices.toArray(new double[0][]);
    }
}
