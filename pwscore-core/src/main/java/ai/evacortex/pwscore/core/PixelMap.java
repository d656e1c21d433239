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

import java.util.Arrays;

/**
 * Immutable two-dimensional per-pixel map, row-major.
 */
public final class PixelMap {

    private final int rows;
    private final int cols;
    private final double[] values;

    public PixelMap(int rows, int cols, double[] values) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidCubeException("Map dimensions must be positive: " + rows + "x" + cols);
        }
        if (values == null || values.length != rows * cols) {
            throw new InvalidCubeException("Map length does not match " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.values = values.clone();
    }

    public static PixelMap of(double[][] grid) {
        int r = grid.length;
        int c = r == 0 ? 0 : grid[0].length;
        double[] flat = new double[r * c];
        for (int i = 0; i < r; i++) {
            if (grid[i].length != c) throw new InvalidCubeException("Ragged grid at row " + i);
            System.arraycopy(grid[i], 0, flat, i * c, c);
        }
        return new PixelMap(r, c, flat);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public double get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + rows + "x" + cols);
        }
        return values[row * cols + col];
    }

    public double at(int flatIndex) {
        return values[flatIndex];
    }

    public double[] copyValues() {
        return values.clone();
    }

    public boolean sameShape(int otherRows, int otherCols) {
        return rows == otherRows && cols == otherCols;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PixelMap)) return false;
        PixelMap other = (PixelMap) obj;
        return rows == other.rows && cols == other.cols && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(values);
    }
}
