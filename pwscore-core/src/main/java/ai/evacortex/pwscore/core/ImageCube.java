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

import java.util.Objects;

/**
 * A raw or partially processed measurement: (row, column, wavelength) values plus a strictly
 * increasing wavelength axis in nanometres and the acquisition metadata.
 */
public final class ImageCube extends SpectralCube {

    private final CubeMetadata metadata;

    public ImageCube(int rows, int cols, double[] data, double[] wavelengths, CubeMetadata metadata) {
        super(rows, cols, data, wavelengths);
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        for (int i = 1; i < axis.length; i++) {
            if (!(axis[i] > axis[i - 1])) {
                throw new InvalidCubeException("Wavelengths must be strictly increasing (index " + i + ")");
            }
        }
    }

    public CubeMetadata metadata() {
        return metadata;
    }

    public double[] wavelengths() {
        return copyAxis();
    }

    /**
     * Returns a cube with the same axis and metadata but different values.
     */
    public ImageCube withData(double[] newData) {
        return new ImageCube(rows, cols, newData, axis, metadata);
    }

    /**
     * Restricts the cube to the wavelengths nearest to {@code start} and {@code stop}, inclusive.
     */
    public ImageCube selectWavelengths(double start, double stop) {
        if (!(start < stop)) {
            throw new InvalidCubeException("Wavelength window start " + start + " must be below stop " + stop);
        }
        int iStart = nearestIndex(start);
        int iStop = nearestIndex(stop);
        int count = iStop - iStart + 1;
        if (count < 2) {
            throw new InvalidCubeException("Wavelength window [" + start + ", " + stop + "] selects fewer than 2 bands");
        }
        double[] out = new double[rows * cols * count];
        for (int p = 0; p < rows * cols; p++) {
            System.arraycopy(data, p * bands + iStart, out, p * count, count);
        }
        double[] wv = new double[count];
        System.arraycopy(axis, iStart, wv, 0, count);
        return new ImageCube(rows, cols, out, wv, metadata);
    }

    private int nearestIndex(double wavelength) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int i = 0; i < axis.length; i++) {
            double d = Math.abs(axis[i] - wavelength);
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "ImageCube(" + rows + "x" + cols + "x" + bands + ", " + axis[0] + "-" + axis[bands - 1]
                + " nm, system=" + metadata.systemId() + ")";
    }
}
