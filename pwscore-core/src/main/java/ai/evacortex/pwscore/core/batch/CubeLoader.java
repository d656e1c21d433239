/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.batch;

import ai.evacortex.pwscore.core.ImageCube;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a raw acquisition from its directory. Implementations need not be thread-safe; the batch
 * runner serializes all calls.
 */
@FunctionalInterface
public interface CubeLoader {

    ImageCube load(Path cubeDirectory) throws IOException;
}
