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
 * Base class for three-dimensional data indexed by (row, column, spectral index) together with
 * the one-dimensional axis that labels the spectral index (wavelength, wavenumber or depth).
 *
 * <p>Values are held in a single row-major array where the spectral index varies fastest:
 * {@code data[(row * cols + col) * bands + band]}. Instances are immutable; the backing array is
 * copied on construction and never exposed. Stages that produce new cubes work on
 * {@link #copyData()} and hand the result to a new instance.</p>
 */
public abstract class SpectralCube {

    protected final int rows;
    protected final int cols;
    protected final int bands;
    protected final double[] data;
    protected final double[] axis;

    protected SpectralCube(int rows, int cols, double[] data, double[] axis) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidCubeException("Spatial dimensions must be positive: " + rows + "x" + cols);
        }
        if (axis == null || axis.length == 0) {
            throw new InvalidCubeException("Spectral axis must not be empty");
        }
        if (data == null || data.length != (long) rows * cols * axis.length) {
            throw new InvalidCubeException("Data length " + (data == null ? 0 : data.length)
                    + " does not match " + rows + "x" + cols + "x" + axis.length);
        }
        this.rows = rows;
        this.cols = cols;
        this.bands = axis.length;
        this.data = data.clone();
        this.axis = axis.clone();
    }

    public int rows()  { return rows; }
    public int cols()  { return cols; }
    public int bands() { return bands; }

    public int pixelCount() {
        return rows * cols;
    }

    public double get(int row, int col, int band) {
        return data[index(row, col, band)];
    }

    public double[] spectrum(int row, int col) {
        int start = index(row, col, 0);
        return Arrays.copyOfRange(data, start, start + bands);
    }

    public double[] copyData() {
        return data.clone();
    }

    public double[] copyAxis() {
        return axis.clone();
    }

    public double axisValue(int band) {
        return axis[band];
    }

    public boolean sameSpatialShape(SpectralCube other) {
        return rows == other.rows && cols == other.cols;
    }

    public boolean sameShape(SpectralCube other) {
        return sameSpatialShape(other) && bands == other.bands;
    }

    /**
     * Mean over the spectral axis of every pixel.
     */
    public PixelMap meanOverSpectrum() {
        double[] out = new double[rows * cols];
        for (int p = 0; p < out.length; p++) {
            double sum = 0.0;
            int base = p * bands;
            for (int b = 0; b < bands; b++) sum += data[base + b];
            out[p] = sum / bands;
        }
        return new PixelMap(rows, cols, out);
    }

    /**
     * Population standard deviation over the spectral axis of every pixel.
     */
    public PixelMap stdOverSpectrum() {
        double[] out = new double[rows * cols];
        for (int p = 0; p < out.length; p++) {
            int base = p * bands;
            double sum = 0.0;
            for (int b = 0; b < bands; b++) sum += data[base + b];
            double mean = sum / bands;
            double sq = 0.0;
            for (int b = 0; b < bands; b++) {
                double d = data[base + b] - mean;
                sq += d * d;
            }
            out[p] = Math.sqrt(sq / bands);
        }
        return new PixelMap(rows, cols, out);
    }

    protected final int index(int row, int col, int band) {
        if (row < 0 || row >= rows || col < 0 || col >= cols || band < 0 || band >= bands) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ", " + band + ") outside "
                    + rows + "x" + cols + "x" + bands);
        }
        return (row * cols + col) * bands + band;
    }
}
