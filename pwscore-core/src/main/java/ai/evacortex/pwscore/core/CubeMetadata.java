/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Acquisition metadata carried by an {@link ImageCube}.
 *
 * @param exposureMs      camera exposure in milliseconds, strictly positive
 * @param acquired        acquisition time stamp
 * @param systemId        identifier of the acquiring instrument
 * @param darkCounts      camera dark-count baseline per pixel, already scaled for binning
 */
public record CubeMetadata(double exposureMs, Instant acquired, String systemId, double darkCounts) {

    public CubeMetadata {
        Objects.requireNonNull(acquired, "acquired must not be null");
        Objects.requireNonNull(systemId, "systemId must not be null");
    }
}
