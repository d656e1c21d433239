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
import ai.evacortex.pwscore.core.math.BoundaryTracer;

import java.awt.geom.Path2D;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, numbered region of interest: a boolean mask over the cube's spatial grid and an optional
 * polygon outline. Vertices are {@code {x, y}} pairs with x along columns and y along rows, in
 * pixel-centre coordinates.
 */
public final class Roi {

    private final String name;
    private final int number;
    private final int rows;
    private final int cols;
    private final boolean[] mask;
    private final double[][] vertices;

    public Roi(String name, int number, int rows, int cols, boolean[] mask, double[][] vertices) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ROI name must not be blank");
        }
        if (rows <= 0 || cols <= 0 || mask == null || mask.length != rows * cols) {
            throw new InvalidCubeException("ROI mask does not match " + rows + "x" + cols);
        }
        this.name = name;
        this.number = number;
        this.rows = rows;
        this.cols = cols;
        this.mask = mask.clone();
        this.vertices = vertices == null ? null : deepCopy(vertices);
    }

    public Roi(String name, int number, int rows, int cols, boolean[] mask) {
        this(name, number, rows, cols, mask, null);
    }

    /**
     * Builds an ROI from a polygon; a pixel belongs to the mask when its centre lies inside.
     */
    public static Roi fromVertices(String name, int number, double[][] vertices, int rows, int cols) {
        Objects.requireNonNull(vertices, "vertices must not be null");
        if (vertices.length < 3) {
            throw new IllegalArgumentException("A polygon needs at least 3 vertices, got " + vertices.length);
        }
        Path2D.Double path = new Path2D.Double();
        path.moveTo(vertices[0][0], vertices[0][1]);
        for (int i = 1; i < vertices.length; i++) {
            path.lineTo(vertices[i][0], vertices[i][1]);
        }
        path.closePath();

        boolean[] mask = new boolean[rows * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                mask[r * cols + c] = path.contains(c, r);
            }
        }
        return new Roi(name, number, rows, cols, mask, vertices);
    }

    public String name()  { return name; }
    public int number()   { return number; }
    public int rows()     { return rows; }
    public int cols()     { return cols; }

    public boolean contains(int row, int col) {
        return mask[row * cols + col];
    }

    public boolean[] mask() {
        return mask.clone();
    }

    public int area() {
        int n = 0;
        for (boolean b : mask) if (b) n++;
        return n;
    }

    public Optional<double[][]> vertices() {
        return Optional.ofNullable(vertices == null ? null : deepCopy(vertices));
    }

    /**
     * Stored vertices, or an outline traced from the mask when none were stored.
     */
    public double[][] verticesOrTraced() {
        return vertices != null ? deepCopy(vertices) : BoundaryTracer.trace(mask, rows, cols);
    }

    public Roi withVertices(double[][] newVertices) {
        return new Roi(name, number, rows, cols, mask, newVertices);
    }

    private static double[][] deepCopy(double[][] v) {
        double[][] out = new double[v.length][];
        for (int i = 0; i < v.length; i++) out[i] = v[i].clone();
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Roi)) return false;
        Roi other = (Roi) obj;
        return number == other.number && rows == other.rows && cols == other.cols
                && name.equals(other.name) && Arrays.equals(mask, other.mask)
                && Arrays.deepEquals(vertices, other.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, number, rows, cols, Arrays.hashCode(mask));
    }

    @Override
    public String toString() {
        return "Roi(" + name + "#" + number + ", " + rows + "x" + cols + ", area=" + area() + ")";
    }
}
