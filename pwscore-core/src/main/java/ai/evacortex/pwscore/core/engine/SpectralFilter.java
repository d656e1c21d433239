/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.FilterCutoffMode;
import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.math.ButterworthFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Zero-phase Butterworth low-pass applied along the wavelength axis of every pixel.
 */
public final class SpectralFilter {

    private static final Logger logger = LoggerFactory.getLogger(SpectralFilter.class);

    private final int order;
    private final double cutoff;
    private final FilterCutoffMode mode;

    public SpectralFilter(int order, double cutoff, FilterCutoffMode mode) {
        this.order = order;
        this.cutoff = cutoff;
        this.mode = mode == null ? FilterCutoffMode.NOMINAL : mode;
    }

    public ImageCube apply(ImageCube cube) {
        int bands = cube.bands();
        if (bands < 2) {
            return cube;
        }
        double step = (cube.axisValue(bands - 1) - cube.axisValue(0)) / (bands - 1);
        ButterworthFilter filter = ButterworthFilter.lowPass(order, mode.normalizedCutoff(cutoff, step));
        if (logger.isDebugEnabled()) {
            logger.debug("Butterworth order {} Wn={} ({}), b={}, a={}", order, filter.wn(), mode,
                    Arrays.toString(filter.b()), Arrays.toString(filter.a()));
        }

        double[] data = cube.copyData();
        double[] pixel = new double[bands];
        for (int p = 0; p < cube.pixelCount(); p++) {
            int base = p * bands;
            System.arraycopy(data, base, pixel, 0, bands);
            double[] filtered = filter.filtfilt(pixel);
            System.arraycopy(filtered, 0, data, base, bands);
        }
        return cube.withData(data);
    }
}
